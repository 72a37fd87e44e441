package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.response.TranscriptResponse;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.entity.Transcript;
import com.Tkmind.recall_bridge.repository.MeetingRepository;
import com.Tkmind.recall_bridge.repository.TranscriptRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TranscriptService {

    private final TranscriptRepository transcriptRepository;
    private final MeetingRepository meetingRepository;
    private final ObjectMapper objectMapper;

    // ── GET by meeting ID ─────────────────────────────────────────────────────

    /**
     * @return the stored transcript, or null while it has not been collected yet
     */
    @Transactional(readOnly = true)
    public TranscriptResponse getTranscriptByMeetingId(Long userId, Long meetingId) {

        Meeting meeting = meetingRepository.findById(meetingId)
                .orElseThrow(() -> new EntityNotFoundException("Meeting not found: " + meetingId));

        if (!meeting.getUserId().equals(userId)) {
            throw new SecurityException("Unauthorized");
        }

        return transcriptRepository.findByMeetingId(meetingId)
                .map(this::mapToResponse)
                .orElseGet(() -> {
                    log.info("Transcript not collected yet for meeting {}", meetingId);
                    return null;
                });
    }

    @Transactional(readOnly = true)
    public Optional<TranscriptResponse> findByMeetingId(Long meetingId) {
        return transcriptRepository.findByMeetingId(meetingId).map(this::mapToResponse);
    }

    // ── Write once ────────────────────────────────────────────────────────────

    /**
     * Inserts the transcript unless the meeting already has one. Two pollers can
     * pass the existence check at the same time; the unique meeting_id column
     * rejects the second insert, which is reported as "not saved" rather than
     * as an error.
     *
     * <p>Not transactional. The insert runs in its own repository transaction.
     *
     * @return true if this call inserted the row
     */
    public boolean saveIfAbsent(Meeting meeting, String botId, NormalizedTranscript normalized) {
        if (transcriptRepository.existsByMeetingId(meeting.getId())) {
            log.info("Transcript already exists for meeting {}, skipping save", meeting.getId());
            return false;
        }

        Transcript transcript = Transcript.builder()
                .meeting(meeting)
                .botId(botId)
                .content(normalized.getText())
                .attendees(toAttendeesJson(normalized))
                .duration(normalized.durationMinutes())
                .processedAt(LocalDateTime.now())
                .build();

        try {
            Transcript saved = transcriptRepository.saveAndFlush(transcript);
            log.info("Transcript {} saved for meeting {} (bot {}, {} words, {} speakers)",
                    saved.getId(), meeting.getId(), botId,
                    normalized.getWords().size(), normalized.getSpeakers().size());
            return true;
        } catch (DataIntegrityViolationException duplicate) {
            log.warn("Transcript for meeting {} was saved concurrently, keeping the existing one",
                    meeting.getId());
            return false;
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String toAttendeesJson(NormalizedTranscript normalized) {
        try {
            return objectMapper.writeValueAsString(normalized.getSpeakers());
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize speakers: {}", e.getMessage());
            return "[]";
        }
    }

    public TranscriptResponse mapToResponse(Transcript t) {
        return TranscriptResponse.builder()
                .id(t.getId())
                .meetingId(t.getMeeting().getId())
                .botId(t.getBotId())
                .content(t.getContent())
                .summary(t.getSummary())
                .attendees(t.getAttendees())
                .duration(t.getDuration())
                .processedAt(t.getProcessedAt())
                .createdAt(t.getCreatedAt())
                .build();
    }
}
