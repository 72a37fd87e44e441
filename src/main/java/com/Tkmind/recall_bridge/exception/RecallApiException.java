package com.Tkmind.recall_bridge.exception;

import lombok.Getter;

/**
 * Non-2xx answer from the Recall.ai API. Polling paths retry on the next tick,
 * on-demand paths surface it to the caller.
 */
@Getter
public class RecallApiException extends RuntimeException {

    private final int statusCode;

    public RecallApiException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }
}
