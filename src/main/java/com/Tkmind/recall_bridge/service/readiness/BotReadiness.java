package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class BotReadiness {

    /** The bot finished its call (done / call_ended). */
    private final boolean ready;

    /** A transcript can be fetched for this bot. */
    private final boolean hasTranscript;

    /** Effective status; may be null when Recall.ai could not be reached. */
    private final String status;

    /** Already-normalized transcript, when a check had to download it. */
    @ToString.Exclude
    private final NormalizedTranscript transcript;

    /** Bot snapshot the decision was made on; null on timeout. */
    @ToString.Exclude
    private final RecallBot bot;

    public boolean isFailed() {
        return BotStatusCodes.isError(status);
    }
}
