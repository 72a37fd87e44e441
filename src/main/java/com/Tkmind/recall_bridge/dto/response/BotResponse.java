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
public class BotResponse {
    private String id;
    private String status;
    private String meetingUrl;
    private String platform;
    private Long meetingId;

    /** True when an existing live bot for the same meeting link was linked instead of creating one. */
    private boolean reused;

    private LocalDateTime joinTime;
    private LocalDateTime createdAt;
}
