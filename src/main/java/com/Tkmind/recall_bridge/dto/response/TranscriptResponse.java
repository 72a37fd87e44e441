package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Stored transcript of a meeting, as collected from the meeting's bot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TranscriptResponse {
    private Long id;
    private Long meetingId;

    /** Recall.ai bot the transcript was collected from. */
    private String botId;

    private String content;
    private String summary;

    /** JSON array of {id, name}. */
    private String attendees;

    /** Minutes. */
    private Integer duration;

    private LocalDateTime processedAt;
    private LocalDateTime createdAt;
}
