package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.response.BotPollResult;
import com.Tkmind.recall_bridge.entity.Bot;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.repository.BotRepository;
import com.Tkmind.recall_bridge.repository.TranscriptRepository;
import com.Tkmind.recall_bridge.service.readiness.BotReadiness;
import com.Tkmind.recall_bridge.service.readiness.BotReadinessService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * One reconciliation step for a meeting with a linked bot: ask the readiness
 * oracle, advance the meeting status, and store the transcript once it is
 * available. Shared by the polling loop and the on-demand status check.
 * Exceptions propagate; the poller turns them into a FAILED result.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MeetingReconciler {

    private final BotReadinessService botReadinessService;
    private final BotRepository botRepository;
    private final TranscriptRepository transcriptRepository;
    private final TranscriptService transcriptService;
    private final MeetingService meetingService;

    public BotPollResult reconcile(Meeting meeting) {
        String botId = meeting.getBotId();
        Optional<Bot> mirror = botRepository.findById(botId);
        String lastKnownStatus = mirror.map(Bot::getStatus).orElse(null);

        BotReadiness readiness = botReadinessService.check(botId, lastKnownStatus);
        mirror.ifPresent(bot -> updateMirror(bot, readiness.getStatus()));

        BotPollResult.BotPollResultBuilder result = BotPollResult.builder()
                .meetingId(meeting.getId())
                .botId(botId)
                .botStatus(readiness.getStatus())
                .ready(readiness.isReady())
                .hasTranscript(readiness.isHasTranscript());

        if (readiness.isReady()) {
            meetingService.transition(meeting.getId(), Meeting.MeetingStatus.COMPLETED);
            return result
                    .outcome(BotPollResult.Outcome.COMPLETED)
                    .transcriptSaved(storeTranscript(meeting, botId, readiness))
                    .build();
        }

        if (readiness.isFailed()) {
            meetingService.transition(meeting.getId(), Meeting.MeetingStatus.ERROR);
            return result.outcome(BotPollResult.Outcome.BOT_ERROR).build();
        }

        return result.outcome(BotPollResult.Outcome.PROCESSING).build();
    }

    private boolean storeTranscript(Meeting meeting, String botId, BotReadiness readiness) {
        if (!readiness.isHasTranscript()) {
            log.info("Bot {} finished but no transcript is available yet for meeting {}", botId, meeting.getId());
            return false;
        }
        if (transcriptRepository.existsByMeetingId(meeting.getId())) {
            log.debug("Meeting {} already has a transcript", meeting.getId());
            return false;
        }

        Optional<NormalizedTranscript> transcript = botReadinessService.fetchTranscript(readiness);
        if (transcript.isEmpty() || !transcript.get().hasText()) {
            log.info("Transcript for bot {} is still empty, retrying on the next poll", botId);
            return false;
        }
        return transcriptService.saveIfAbsent(meeting, botId, transcript.get());
    }

    private void updateMirror(Bot bot, String status) {
        if (status == null || Objects.equals(bot.getStatus(), status)) {
            return;
        }
        log.debug("Bot {} status {} -> {}", bot.getId(), bot.getStatus(), status);
        bot.setStatus(status);
        botRepository.save(bot);
    }
}
