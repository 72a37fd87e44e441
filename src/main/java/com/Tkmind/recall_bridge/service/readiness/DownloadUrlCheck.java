package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallRecording;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/** A recording exposing a transcript download URL, whatever its status code says. */
@Component
@Order(2)
public class DownloadUrlCheck implements ReadinessCheck {

    @Override
    public String name() {
        return "download-url";
    }

    @Override
    public Result check(RecallBot bot) {
        List<RecallRecording> recordings = bot.getRecordings() != null ? bot.getRecordings() : List.of();
        boolean exposed = recordings.stream()
                .anyMatch(r -> r != null && r.transcriptDownloadUrl() != null);
        return exposed ? Result.ready() : Result.unknown();
    }
}
