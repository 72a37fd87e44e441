package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.exception.RecallTimeoutException;
import com.Tkmind.recall_bridge.service.RecallApiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Decides whether a bot has finished and whether its transcript can be fetched.
 *
 * <p>Order of evaluation:
 * <ol>
 *   <li>effective status = last status_changes code, falling back to the top-level status</li>
 *   <li>a bot already seen done/call_ended stays ready even if Recall.ai now reports otherwise</li>
 *   <li>non-terminal status: not ready</li>
 *   <li>error: not ready, failed</li>
 *   <li>done/call_ended: the {@link ReadinessCheck} chain decides whether a transcript is available</li>
 * </ol>
 * A timeout reaching Recall.ai is reported as "not ready yet", never as a failure.
 * Other Recall.ai errors propagate.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotReadinessService {

    private final RecallApiService recallApiService;
    private final TranscriptDownloader transcriptDownloader;
    private final List<ReadinessCheck> checks;

    public BotReadiness check(String botId) {
        return check(botId, null);
    }

    /**
     * @param lastKnownStatus status mirrored locally from an earlier poll, may be null
     */
    public BotReadiness check(String botId, String lastKnownStatus) {
        RecallBot bot;
        try {
            bot = recallApiService.getBot(botId);
        } catch (RecallTimeoutException e) {
            log.warn("Bot {} status unavailable ({}), treating as not ready yet", botId, e.getMessage());
            return BotReadiness.builder()
                    .ready(BotStatusCodes.isReady(lastKnownStatus))
                    .hasTranscript(false)
                    .status(lastKnownStatus)
                    .build();
        }

        String status = bot.effectiveStatus();

        if (BotStatusCodes.isReady(lastKnownStatus) && !BotStatusCodes.isReady(status)) {
            log.warn("Bot {} reported '{}' after '{}', keeping '{}'", botId, status, lastKnownStatus, lastKnownStatus);
            status = lastKnownStatus;
        }

        if (!BotStatusCodes.isTerminal(status)) {
            log.debug("Bot {} still in progress (status={})", botId, status);
            return BotReadiness.builder().ready(false).hasTranscript(false).status(status).bot(bot).build();
        }

        if (BotStatusCodes.isError(status)) {
            log.info("Bot {} ended in error", botId);
            return BotReadiness.builder().ready(false).hasTranscript(false).status(status).bot(bot).build();
        }

        for (ReadinessCheck check : checks) {
            ReadinessCheck.Result result = check.check(bot);
            if (result.getVerdict() == ReadinessVerdict.UNKNOWN) {
                continue;
            }
            boolean hasTranscript = result.getVerdict() == ReadinessVerdict.READY;
            log.debug("Bot {} transcript availability decided by {}: {}", botId, check.name(), hasTranscript);
            return BotReadiness.builder()
                    .ready(true)
                    .hasTranscript(hasTranscript)
                    .status(status)
                    .transcript(result.getTranscript())
                    .bot(bot)
                    .build();
        }

        return BotReadiness.builder().ready(true).hasTranscript(false).status(status).bot(bot).build();
    }

    /**
     * Normalized transcript for a bot reported as having one. Reuses the copy a
     * check already downloaded, otherwise downloads it from the bot snapshot.
     */
    public Optional<NormalizedTranscript> fetchTranscript(BotReadiness readiness) {
        if (!readiness.isHasTranscript()) {
            return Optional.empty();
        }
        if (readiness.getTranscript() != null) {
            return Optional.of(readiness.getTranscript());
        }
        if (readiness.getBot() == null) {
            return Optional.empty();
        }
        return transcriptDownloader.download(readiness.getBot());
    }
}
