package com.Tkmind.recall_bridge.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollSummary {
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private int polled;
    private int completed;
    private int processing;
    private int errored;
    private int failed;
    private int transcriptsSaved;

    @Builder.Default
    private List<BotPollResult> results = new ArrayList<>();

    public static PollSummary of(LocalDateTime startedAt, List<BotPollResult> results) {
        PollSummary summary = PollSummary.builder()
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now())
                .polled(results.size())
                .results(results)
                .build();
        for (BotPollResult result : results) {
            switch (result.getOutcome()) {
                case COMPLETED -> summary.completed++;
                case PROCESSING -> summary.processing++;
                case BOT_ERROR -> summary.errored++;
                case FAILED -> summary.failed++;
            }
            if (result.isTranscriptSaved()) {
                summary.transcriptsSaved++;
            }
        }
        return summary;
    }
}
