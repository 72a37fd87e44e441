package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallRecording;
import com.Tkmind.recall_bridge.exception.RecallTimeoutException;
import com.Tkmind.recall_bridge.service.RecallApiService;
import com.Tkmind.recall_bridge.service.TranscriptNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Picks the transcript artifact of a bot's recordings, downloads it and
 * normalizes it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TranscriptDownloader {

    private final RecallApiService recallApiService;
    private final TranscriptNormalizer transcriptNormalizer;

    /**
     * Empty when no recording exposes a download URL yet or the download timed out.
     * Recall.ai HTTP errors propagate.
     */
    public Optional<NormalizedTranscript> download(RecallBot bot) {
        Optional<String> downloadUrl = findDownloadUrl(bot);
        if (downloadUrl.isEmpty()) {
            log.debug("Bot {} has no transcript download URL yet", bot.getId());
            return Optional.empty();
        }

        try {
            Object raw = recallApiService.fetchRawTranscript(downloadUrl.get());
            return Optional.of(transcriptNormalizer.normalize(raw));
        } catch (RecallTimeoutException e) {
            log.warn("Transcript download for bot {} timed out, will retry", bot.getId());
            return Optional.empty();
        }
    }

    /**
     * Recordings whose transcript status is "done" come first; after that any
     * recording that already exposes a URL.
     */
    public Optional<String> findDownloadUrl(RecallBot bot) {
        List<RecallRecording> recordings = bot.getRecordings() != null ? bot.getRecordings() : List.of();
        return recordings.stream()
                .filter(r -> r != null && r.transcriptDownloadUrl() != null)
                .sorted(Comparator.comparing(
                        (RecallRecording r) -> !BotStatusCodes.DONE.equals(r.transcriptStatusCode())))
                .map(RecallRecording::transcriptDownloadUrl)
                .findFirst();
    }
}
