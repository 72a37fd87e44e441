package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.dto.request.MeetingScheduleRequest;
import com.Tkmind.recall_bridge.dto.response.MeetingResponse;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.exception.BotAlreadyTrackedException;
import com.Tkmind.recall_bridge.repository.MeetingRepository;
import com.Tkmind.recall_bridge.util.MeetingUrls;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class MeetingService {

    private final MeetingRepository meetingRepository;

    // ─────────────────────────────────────────────
    // Register Meeting
    // ─────────────────────────────────────────────

    @Transactional
    public MeetingResponse scheduleMeeting(Long userId, MeetingScheduleRequest request) {

        Meeting meeting = Meeting.builder()
                .userId(userId)
                .title(request.getTitle())
                .startTime(request.getStartTime())
                .endTime(request.getEndTime())
                .meetingUrl(request.getMeetingUrl())
                .platform(MeetingUrls.platformOf(request.getMeetingUrl()).orElse(null))
                .status(Meeting.MeetingStatus.SCHEDULED)
                .build();

        meeting = meetingRepository.save(meeting);

        log.info("Meeting {} registered for user {}", meeting.getId(), userId);

        return mapToResponse(meeting);
    }

    // ─────────────────────────────────────────────
    // Read Operations
    // ─────────────────────────────────────────────

    @Transactional(readOnly = true)
    public List<MeetingResponse> getUserMeetings(Long userId) {
        return meetingRepository
                .findByUserIdOrderByStartTimeDesc(userId)
                .stream()
                .map(this::mapToResponse)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public MeetingResponse getMeetingById(Long userId, Long meetingId) {
        return mapToResponse(findOwnedMeeting(userId, meetingId));
    }

    @Transactional(readOnly = true)
    public Meeting findOwnedMeeting(Long userId, Long meetingId) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() ->
                        new EntityNotFoundException("Meeting not found: " + meetingId));

        if (!meeting.getUserId().equals(userId)) {
            throw new SecurityException("Unauthorized: meeting belongs to another user");
        }

        return meeting;
    }

    /**
     * The caller's meeting tracking the bot. A bot tracked only by another
     * user's meetings is forbidden; a bot no meeting tracks is not found.
     */
    @Transactional(readOnly = true)
    public Meeting findByBotId(Long userId, String botId) {
        return meetingRepository.findFirstByBotIdAndUserIdOrderByIdAsc(botId, userId)
                .orElseThrow(() -> {
                    if (meetingRepository.existsByBotId(botId)) {
                        return new SecurityException("Unauthorized: bot belongs to another user");
                    }
                    return new EntityNotFoundException("Bot not found: " + botId);
                });
    }

    // ─────────────────────────────────────────────
    // Bot Tracking
    // ─────────────────────────────────────────────

    @Transactional
    public Meeting linkBot(Long meetingId, String botId) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() ->
                        new EntityNotFoundException("Meeting not found: " + meetingId));

        if (meeting.getBotId() != null && !meeting.getBotId().equals(botId)) {
            throw new BotAlreadyTrackedException(meetingId, meeting.getBotId());
        }

        meeting.setBotId(botId);
        if (meeting.getStatus().canTransitionTo(Meeting.MeetingStatus.IN_PROGRESS)) {
            meeting.setStatus(Meeting.MeetingStatus.IN_PROGRESS);
        }
        meeting = meetingRepository.save(meeting);

        log.info("Bot {} linked to meeting {}", botId, meetingId);
        return meeting;
    }

    /**
     * Stops tracking the meeting's bot. The bot itself keeps running on Recall.ai.
     */
    @Transactional
    public Meeting unlinkBot(Long meetingId) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() ->
                        new EntityNotFoundException("Meeting not found: " + meetingId));

        String previousBotId = meeting.getBotId();
        meeting.setBotId(null);
        meeting.setStatus(Meeting.MeetingStatus.SCHEDULED);
        meeting = meetingRepository.save(meeting);

        log.info("Bot {} no longer tracked for meeting {}", previousBotId, meetingId);
        return meeting;
    }

    // ─────────────────────────────────────────────
    // Status Transitions
    // ─────────────────────────────────────────────

    /**
     * Applies a forward-only status change on the current row.
     *
     * @return true if the status changed
     */
    @Transactional
    public boolean transition(Long meetingId, Meeting.MeetingStatus next) {
        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() ->
                        new EntityNotFoundException("Meeting not found: " + meetingId));

        if (!meeting.getStatus().canTransitionTo(next)) {
            log.debug("Meeting {} stays {} (requested {})", meetingId, meeting.getStatus(), next);
            return false;
        }

        log.info("Meeting {} status {} -> {}", meetingId, meeting.getStatus(), next);
        meeting.setStatus(next);
        meetingRepository.save(meeting);
        return true;
    }

    // ─────────────────────────────────────────────
    // Helpers
    // ─────────────────────────────────────────────

    public MeetingResponse mapToResponse(Meeting m) {
        return MeetingResponse.builder()
                .id(m.getId())
                .title(m.getTitle())
                .startTime(m.getStartTime())
                .endTime(m.getEndTime())
                .platform(m.getPlatform())
                .meetingUrl(m.getMeetingUrl())
                .botId(m.getBotId())
                .status(m.getStatus().name())
                .createdAt(m.getCreatedAt())
                .updatedAt(m.getUpdatedAt())
                .build();
    }
}
