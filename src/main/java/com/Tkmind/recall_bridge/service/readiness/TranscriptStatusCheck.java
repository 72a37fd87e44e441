package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallRecording;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** A recording whose transcript media shortcut reports status "done". */
@Component
@Order(1)
public class TranscriptStatusCheck implements ReadinessCheck {

    @Override
    public String name() {
        return "transcript-status";
    }

    @Override
    public Result check(RecallBot bot) {
        List<RecallRecording> recordings = bot.getRecordings() != null ? bot.getRecordings() : List.of();
        boolean done = recordings.stream()
                .anyMatch(r -> r != null && BotStatusCodes.DONE.equals(r.transcriptStatusCode()));
        return done ? Result.ready() : Result.unknown();
    }
}
