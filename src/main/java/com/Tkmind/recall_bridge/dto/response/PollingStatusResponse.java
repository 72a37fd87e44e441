package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollingStatusResponse {
    private boolean running;
    private long intervalMs;
    private PollSummary lastTick;
    private String message;
}
