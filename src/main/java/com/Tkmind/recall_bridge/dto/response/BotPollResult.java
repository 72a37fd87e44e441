package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of reconciling one meeting against its bot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotPollResult {

    public enum Outcome {
        COMPLETED, PROCESSING, BOT_ERROR, FAILED
    }

    private Long meetingId;
    private String botId;
    private Outcome outcome;
    private String botStatus;
    private boolean ready;
    private boolean hasTranscript;
    private boolean transcriptSaved;

    /** Exception message when the reconciliation itself threw. */
    private String error;
}
