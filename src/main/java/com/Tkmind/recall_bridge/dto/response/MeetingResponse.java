package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MeetingResponse {
    private Long id;
    private String title;
    private LocalDateTime startTime;
    private LocalDateTime endTime;

    /** zoom, meet or teams; null when the link is missing or unsupported. */
    private String platform;

    private String meetingUrl;

    /** Bot currently tracked for this meeting, if any. */
    private String botId;

    /** SCHEDULED, IN_PROGRESS, COMPLETED or ERROR. */
    private String status;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
