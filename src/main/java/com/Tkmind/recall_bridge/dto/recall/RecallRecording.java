package com.Tkmind.recall_bridge.dto.recall;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecallRecording {

    private String id;

    private Object status;

    @JsonProperty("media_shortcuts")
    private MediaShortcuts mediaShortcuts;

    @JsonProperty("created_at")
    private String createdAt;

    public String transcriptStatusCode() {
        MediaShortcut transcript = transcript();
        if (transcript == null || transcript.getStatus() == null) return null;
        return transcript.getStatus().getCode();
    }

    public String transcriptDownloadUrl() {
        MediaShortcut transcript = transcript();
        if (transcript == null || transcript.getData() == null) return null;
        String url = transcript.getData().getDownloadUrl();
        return url == null || url.isBlank() ? null : url;
    }

    private MediaShortcut transcript() {
        return mediaShortcuts != null ? mediaShortcuts.getTranscript() : null;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MediaShortcuts {
        private MediaShortcut transcript;

        @JsonProperty("video_mixed_mp4")
        private MediaShortcut videoMixedMp4;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class MediaShortcut {
        private ShortcutStatus status;
        private ShortcutData data;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShortcutStatus {
        private String code;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ShortcutData {
        @JsonProperty("download_url")
        private String downloadUrl;
    }
}
