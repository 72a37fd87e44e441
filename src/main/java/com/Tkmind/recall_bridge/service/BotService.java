package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.config.RecallConfig;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallBotCreateRequest;
import com.Tkmind.recall_bridge.dto.request.BotCreateRequest;
import com.Tkmind.recall_bridge.dto.response.BotPollResult;
import com.Tkmind.recall_bridge.dto.response.BotResponse;
import com.Tkmind.recall_bridge.dto.response.BotStatusResponse;
import com.Tkmind.recall_bridge.dto.response.TranscriptResponse;
import com.Tkmind.recall_bridge.entity.Bot;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.exception.BotAlreadyTrackedException;
import com.Tkmind.recall_bridge.exception.RecallApiException;
import com.Tkmind.recall_bridge.exception.UnsupportedPlatformException;
import com.Tkmind.recall_bridge.repository.BotRepository;
import com.Tkmind.recall_bridge.service.readiness.BotStatusCodes;
import com.Tkmind.recall_bridge.util.MeetingUrls;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Bot lifecycle: request a bot for a meeting (reusing a live bot already sent
 * to the same link), stop tracking it, and check on it on demand.
 *
 * <p>Not transactional. Provider calls happen outside any database
 * transaction, and the unique (user_id, active_meeting_url) key on
 * {@code bots} is what settles two concurrent requests for the same link.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotService {

    private final RecallApiService recallApiService;
    private final BotRepository botRepository;
    private final MeetingService meetingService;
    private final TranscriptService transcriptService;
    private final MeetingReconciler meetingReconciler;
    private final RecallConfig recallConfig;

    // ─────────────────────────────────────────────
    // Ensure Bot
    // ─────────────────────────────────────────────

    public BotResponse ensureBot(Long userId, BotCreateRequest request) {
        Meeting meeting = meetingService.findOwnedMeeting(userId, request.getMeetingId());
        int joinMinutesBefore = request.getJoinMinutesBefore() != null
                ? request.getJoinMinutesBefore()
                : recallConfig.getBot().getDefaultJoinMinutesBefore();
        return ensureBot(meeting, joinMinutesBefore);
    }

    public BotResponse ensureBot(Meeting meeting, int joinMinutesBefore) {
        String meetingUrl = meeting.getMeetingUrl();
        if (meetingUrl == null || meetingUrl.isBlank()) {
            throw new IllegalArgumentException("Meeting " + meeting.getId() + " has no meeting URL");
        }
        if (!MeetingUrls.isSupported(meetingUrl)) {
            throw new UnsupportedPlatformException(meetingUrl);
        }
        if (meeting.getBotId() != null) {
            throw new BotAlreadyTrackedException(meeting.getId(), meeting.getBotId());
        }

        String cleanUrl = MeetingUrls.clean(meetingUrl);
        LocalDateTime joinTime = meeting.getStartTime() != null
                ? meeting.getStartTime().minusMinutes(joinMinutesBefore)
                : null;
        if (joinTime != null && !joinTime.isAfter(LocalDateTime.now())) {
            joinTime = null;
        }

        Optional<Bot> reusable = findReusableBot(meeting.getUserId(), cleanUrl);
        Bot bot;
        boolean reused;
        if (reusable.isPresent()) {
            bot = reusable.get();
            reused = true;
            log.info("Reusing bot {} for meeting {} ({})", bot.getId(), meeting.getId(), cleanUrl);
        } else {
            Bot created = createBot(meeting, cleanUrl, joinTime);
            bot = recordBot(created);
            reused = !bot.getId().equals(created.getId());
        }

        meetingService.linkBot(meeting.getId(), bot.getId());

        return BotResponse.builder()
                .id(bot.getId())
                .status(bot.getStatus())
                .meetingUrl(bot.getMeetingUrl())
                .platform(bot.getPlatform())
                .meetingId(meeting.getId())
                .reused(reused)
                .joinTime(joinTime)
                .createdAt(bot.getCreatedAt())
                .build();
    }

    /**
     * A stored bot for the same link is reusable only while Recall.ai still
     * knows it and it has not finished. Dead bots are retired so the new bot
     * can take the link; their rows stay for the meetings that still use them.
     */
    private Optional<Bot> findReusableBot(Long userId, String cleanUrl) {
        Optional<Bot> existing = botRepository.findByUserIdAndActiveMeetingUrl(userId, cleanUrl);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Bot bot = existing.get();

        String status;
        try {
            status = recallApiService.getBot(bot.getId()).effectiveStatus();
        } catch (RecallApiException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.warn("Stored bot {} no longer exists on Recall.ai, replacing it", bot.getId());
            retire(bot);
            return Optional.empty();
        }

        if (BotStatusCodes.isTerminal(status)) {
            log.info("Stored bot {} already finished ({}), replacing it", bot.getId(), status);
            bot.setStatus(status);
            retire(bot);
            return Optional.empty();
        }

        if (status != null && !status.equals(bot.getStatus())) {
            bot.setStatus(status);
            bot = botRepository.save(bot);
        }
        return Optional.of(bot);
    }

    // flushed so the link is free before the replacement bot is inserted
    private void retire(Bot bot) {
        bot.setActiveMeetingUrl(null);
        botRepository.saveAndFlush(bot);
    }

    private Bot createBot(Meeting meeting, String cleanUrl, LocalDateTime joinTime) {
        String botName = recallConfig.getBot().getAppName() + " Bot - " + meeting.getTitle();

        RecallBotCreateRequest request = RecallBotCreateRequest.builder()
                .meetingUrl(cleanUrl)
                .botName(botName)
                .joinAt(joinTime != null
                        ? joinTime.atZone(ZoneId.systemDefault()).toInstant().toString()
                        : null)
                .build();

        RecallBot created = recallApiService.createBot(request);

        return Bot.builder()
                .id(created.getId())
                .userId(meeting.getUserId())
                .meetingUrl(cleanUrl)
                .activeMeetingUrl(cleanUrl)
                .botName(botName)
                .status(created.effectiveStatus())
                .platform(MeetingUrls.platformOf(cleanUrl).orElse(null))
                .build();
    }

    /**
     * Stores the freshly created bot. When another request stored a bot for
     * the same link first, that bot wins and the one just created is left
     * orphaned on Recall.ai.
     */
    private Bot recordBot(Bot created) {
        try {
            Bot saved = botRepository.saveAndFlush(created);
            log.info("Bot {} created for {}", saved.getId(), saved.getMeetingUrl());
            return saved;
        } catch (DataIntegrityViolationException duplicate) {
            Bot winner = botRepository.findByUserIdAndActiveMeetingUrl(created.getUserId(), created.getMeetingUrl())
                    .orElseThrow(() -> duplicate);
            log.warn("Concurrent bot creation for {}: using bot {}, bot {} is orphaned on Recall.ai",
                    created.getMeetingUrl(), winner.getId(), created.getId());
            return winner;
        }
    }

    // ─────────────────────────────────────────────
    // Remove Bot
    // ─────────────────────────────────────────────

    /**
     * Stops tracking the bot for its meeting. The bot is not deleted on
     * Recall.ai and the local bot row stays available for reuse.
     */
    public void removeBot(String botId, Long userId) {
        Meeting meeting = meetingService.findByBotId(userId, botId);
        meetingService.unlinkBot(meeting.getId());
    }

    // ─────────────────────────────────────────────
    // Check Bot
    // ─────────────────────────────────────────────

    public BotStatusResponse checkBot(String botId, Long userId) {
        Meeting meeting = meetingService.findByBotId(userId, botId);

        Optional<TranscriptResponse> stored = transcriptService.findByMeetingId(meeting.getId());
        if (stored.isPresent()) {
            log.debug("Bot {} already has a stored transcript", botId);
            return BotStatusResponse.builder()
                    .botId(botId)
                    .botStatus(botRepository.findById(botId).map(Bot::getStatus).orElse(null))
                    .ready(true)
                    .hasTranscript(true)
                    .meeting(meetingService.mapToResponse(meeting))
                    .transcript(stored.get())
                    .build();
        }

        BotPollResult result = meetingReconciler.reconcile(meeting);

        return BotStatusResponse.builder()
                .botId(botId)
                .botStatus(result.getBotStatus())
                .ready(result.isReady())
                .hasTranscript(result.isHasTranscript())
                .meeting(meetingService.getMeetingById(userId, meeting.getId()))
                .transcript(transcriptService.findByMeetingId(meeting.getId()).orElse(null))
                .build();
    }
}
