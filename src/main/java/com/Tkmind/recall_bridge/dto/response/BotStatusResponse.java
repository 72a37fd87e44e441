package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BotStatusResponse {
    private String botId;
    private String botStatus;
    private boolean ready;
    private boolean hasTranscript;
    private MeetingResponse meeting;
    private TranscriptResponse transcript;
}
