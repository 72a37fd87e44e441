package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.exception.RecallApiException;
import com.Tkmind.recall_bridge.exception.RecallTimeoutException;
import com.Tkmind.recall_bridge.service.RecallApiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last resort when the recordings carry no transcript metadata: re-read the bot
 * and try to download whatever transcript it exposes. A non-empty normalized
 * text counts as ready. Always answers READY or NOT_READY.
 */
@Component
@Order(3)
@RequiredArgsConstructor
@Slf4j
public class SpeculativeFetchCheck implements ReadinessCheck {

    private final RecallApiService recallApiService;
    private final TranscriptDownloader transcriptDownloader;

    @Override
    public String name() {
        return "speculative-fetch";
    }

    @Override
    public Result check(RecallBot bot) {
        if (!bot.hasRecordings()) {
            return Result.notReady();
        }

        try {
            RecallBot fresh = recallApiService.getBot(bot.getId());
            Optional<NormalizedTranscript> transcript = transcriptDownloader.download(fresh);
            if (transcript.isPresent() && transcript.get().hasText()) {
                log.info("Bot {} transcript found by direct fetch", bot.getId());
                return Result.ready(transcript.get());
            }
        } catch (RecallApiException | RecallTimeoutException e) {
            log.debug("Direct transcript fetch for bot {} failed: {}", bot.getId(), e.getMessage());
        }
        return Result.notReady();
    }
}
