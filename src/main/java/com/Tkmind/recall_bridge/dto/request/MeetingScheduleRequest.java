package com.Tkmind.recall_bridge.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class MeetingScheduleRequest {

    @NotBlank(message = "Title is required")
    private String title;

    @NotNull(message = "Start time is required")
    private LocalDateTime startTime;

    private LocalDateTime endTime;

    /**
     * Zoom / Google Meet / Teams meeting URL. A bot can only be requested for
     * meetings that have one.
     */
    private String meetingUrl;
}
