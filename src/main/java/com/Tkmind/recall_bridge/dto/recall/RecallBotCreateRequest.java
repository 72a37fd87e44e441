package com.Tkmind.recall_bridge.dto.recall;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Body of POST /bot. Transcription uses the meeting's own captions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecallBotCreateRequest {

    @JsonProperty("meeting_url")
    private String meetingUrl;

    @JsonProperty("bot_name")
    private String botName;

    /** ISO-8601 instant; omitted to join immediately. */
    @JsonProperty("join_at")
    private String joinAt;

    @JsonProperty("recording_config")
    @Builder.Default
    private Map<String, Object> recordingConfig = defaultRecordingConfig();

    public static Map<String, Object> defaultRecordingConfig() {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("transcript", Map.of("provider", Map.of("meeting_captions", Map.of())));
        config.put("participant_events", Map.of());
        config.put("video_mixed_mp4", Map.of());
        config.put("meeting_metadata", Map.of());
        return config;
    }
}
