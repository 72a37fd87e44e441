package com.Tkmind.recall_bridge.service.readiness;

import java.util.Set;

/**
 * Recall.ai bot status codes. done and call_ended mean the recording is over;
 * error means the bot failed. Every other code is still in progress.
 */
public final class BotStatusCodes {

    public static final String DONE = "done";
    public static final String CALL_ENDED = "call_ended";
    public static final String ERROR = "error";

    private static final Set<String> READY = Set.of(DONE, CALL_ENDED);

    private BotStatusCodes() {
    }

    public static boolean isReady(String status) {
        return status != null && READY.contains(status);
    }

    public static boolean isError(String status) {
        return ERROR.equals(status);
    }

    public static boolean isTerminal(String status) {
        return isReady(status) || isError(status);
    }
}
