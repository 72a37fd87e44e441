package com.Tkmind.recall_bridge.exception;

/**
 * Recall.ai did not answer within the configured connect/read timeout.
 * Callers treat this as "not ready yet", never as a bot failure.
 */
public class RecallTimeoutException extends RuntimeException {

    public RecallTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
