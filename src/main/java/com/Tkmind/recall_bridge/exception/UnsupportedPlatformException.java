package com.Tkmind.recall_bridge.exception;

public class UnsupportedPlatformException extends RuntimeException {

    public UnsupportedPlatformException(String meetingUrl) {
        super("Meeting platform not supported by Recall.ai: " + meetingUrl);
    }
}
