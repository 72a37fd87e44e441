package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.config.RecallConfig;
import com.Tkmind.recall_bridge.dto.response.BotPollResult;
import com.Tkmind.recall_bridge.dto.response.PollSummary;
import com.Tkmind.recall_bridge.dto.response.PollingStatusResponse;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.repository.MeetingRepository;
import com.Tkmind.recall_bridge.repository.TranscriptRepository;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Background loop that reconciles every meeting with a linked bot and no
 * stored transcript. One tick runs immediately on start, then one every
 * {@code recall.polling.interval-ms} after the previous tick finished.
 *
 * <p>A failing meeting never aborts a tick, and a failing tick never stops
 * the loop. {@link #forceTick()} runs on the caller's thread and may overlap
 * a scheduled tick; the unique transcript per meeting keeps that safe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotPollingService {

    private static final EnumSet<Meeting.MeetingStatus> POLLED_STATUSES = EnumSet.of(
            Meeting.MeetingStatus.SCHEDULED,
            Meeting.MeetingStatus.IN_PROGRESS,
            Meeting.MeetingStatus.COMPLETED);

    private final TaskScheduler taskScheduler;
    private final MeetingRepository meetingRepository;
    private final TranscriptRepository transcriptRepository;
    private final MeetingReconciler meetingReconciler;
    private final RecallConfig recallConfig;

    private ScheduledFuture<?> handle;
    private volatile PollSummary lastSummary;

    // ─────────────────────────────────────────────
    // Lifecycle
    // ─────────────────────────────────────────────

    @EventListener(ApplicationReadyEvent.class)
    public void startOnBoot() {
        if (recallConfig.getPolling().isAutoStart()) {
            start();
        } else {
            log.info("Bot polling auto-start disabled");
        }
    }

    /**
     * @return false if the poller was already running
     */
    public synchronized boolean start() {
        if (handle != null) {
            log.debug("Bot polling already running");
            return false;
        }
        long intervalMs = recallConfig.getPolling().getIntervalMs();
        handle = taskScheduler.scheduleWithFixedDelay(this::scheduledTick, Duration.ofMillis(intervalMs));
        log.info("Bot polling started (every {} ms)", intervalMs);
        return true;
    }

    /**
     * @return false if the poller was not running
     */
    @PreDestroy
    public synchronized boolean stop() {
        if (handle == null) {
            return false;
        }
        // an in-flight tick finishes, no new tick starts
        handle.cancel(false);
        handle = null;
        log.info("Bot polling stopped");
        return true;
    }

    public synchronized boolean isRunning() {
        return handle != null;
    }

    public PollingStatusResponse getStatus() {
        return PollingStatusResponse.builder()
                .running(isRunning())
                .intervalMs(recallConfig.getPolling().getIntervalMs())
                .lastTick(lastSummary)
                .build();
    }

    // ─────────────────────────────────────────────
    // Ticks
    // ─────────────────────────────────────────────

    public PollSummary forceTick() {
        log.info("Forced bot poll requested");
        return tick();
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Bot polling tick failed: {}", e.getMessage(), e);
        }
    }

    PollSummary tick() {
        LocalDateTime startedAt = LocalDateTime.now();

        List<Meeting> pending = meetingRepository.findByBotIdIsNotNullAndStatusInOrderByIdAsc(POLLED_STATUSES)
                .stream()
                .filter(m -> !transcriptRepository.existsByMeetingId(m.getId()))
                .toList();

        List<BotPollResult> results = new ArrayList<>();
        for (Meeting meeting : pending) {
            results.add(pollOne(meeting));
        }

        PollSummary summary = PollSummary.of(startedAt, results);
        lastSummary = summary;

        if (summary.getPolled() > 0) {
            log.info("Bot poll: {} polled, {} completed, {} processing, {} bot errors, {} failed, {} transcripts saved",
                    summary.getPolled(), summary.getCompleted(), summary.getProcessing(),
                    summary.getErrored(), summary.getFailed(), summary.getTranscriptsSaved());
        } else {
            log.debug("Bot poll: nothing to do");
        }
        return summary;
    }

    private BotPollResult pollOne(Meeting meeting) {
        try {
            return meetingReconciler.reconcile(meeting);
        } catch (Exception e) {
            log.error("Polling bot {} for meeting {} failed: {}",
                    meeting.getBotId(), meeting.getId(), e.getMessage(), e);
            return BotPollResult.builder()
                    .meetingId(meeting.getId())
                    .botId(meeting.getBotId())
                    .outcome(BotPollResult.Outcome.FAILED)
                    .error(e.getMessage())
                    .build();
        }
    }
}
