package com.Tkmind.recall_bridge.exception;

import lombok.Getter;

@Getter
public class BotAlreadyTrackedException extends RuntimeException {

    private final String botId;

    public BotAlreadyTrackedException(Long meetingId, String botId) {
        super("Bot already exists for meeting " + meetingId + ": " + botId);
        this.botId = botId;
    }
}
