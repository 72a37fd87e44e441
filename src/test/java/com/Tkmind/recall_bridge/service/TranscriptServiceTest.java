package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.entity.Meeting;
import com.Tkmind.recall_bridge.entity.Transcript;
import com.Tkmind.recall_bridge.repository.MeetingRepository;
import com.Tkmind.recall_bridge.repository.TranscriptRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TranscriptServiceTest {

    @Mock private TranscriptRepository transcriptRepository;
    @Mock private MeetingRepository meetingRepository;

    private TranscriptService transcriptService;
    private Meeting meeting;

    @BeforeEach
    void setUp() {
        transcriptService = new TranscriptService(transcriptRepository, meetingRepository, new ObjectMapper());
        meeting = Meeting.builder().id(10L).userId(1L).title("Standup").build();
    }

    private static NormalizedTranscript transcript() {
        return NormalizedTranscript.builder()
                .text("hello world")
                .words(List.of(
                        new NormalizedTranscript.Word("hello", 0, 1),
                        new NormalizedTranscript.Word("world", 1, 150)))
                .speakers(List.of(new NormalizedTranscript.Speaker("1", "Ana")))
                .build();
    }

    @Test
    void savesTranscriptWithDurationAndAttendees() {
        when(transcriptRepository.existsByMeetingId(10L)).thenReturn(false);
        when(transcriptRepository.saveAndFlush(any(Transcript.class))).thenAnswer(inv -> inv.getArgument(0));

        boolean saved = transcriptService.saveIfAbsent(meeting, "bot-1", transcript());

        assertThat(saved).isTrue();
        ArgumentCaptor<Transcript> captor = ArgumentCaptor.forClass(Transcript.class);
        verify(transcriptRepository).saveAndFlush(captor.capture());
        Transcript stored = captor.getValue();
        assertThat(stored.getMeeting()).isSameAs(meeting);
        assertThat(stored.getBotId()).isEqualTo("bot-1");
        assertThat(stored.getContent()).isEqualTo("hello world");
        assertThat(stored.getDuration()).isEqualTo(3);
        assertThat(stored.getAttendees()).isEqualTo("[{\"id\":\"1\",\"name\":\"Ana\"}]");
        assertThat(stored.getProcessedAt()).isNotNull();
    }

    @Test
    void existingTranscriptIsNeverOverwritten() {
        when(transcriptRepository.existsByMeetingId(10L)).thenReturn(true);

        assertThat(transcriptService.saveIfAbsent(meeting, "bot-1", transcript())).isFalse();
        verify(transcriptRepository, never()).saveAndFlush(any());
    }

    @Test
    void concurrentDuplicateInsertIsNotAnError() {
        when(transcriptRepository.existsByMeetingId(10L)).thenReturn(false);
        when(transcriptRepository.saveAndFlush(any(Transcript.class)))
                .thenThrow(new DataIntegrityViolationException("transcripts.meeting_id"));

        assertThat(transcriptService.saveIfAbsent(meeting, "bot-1", transcript())).isFalse();
    }

    @Test
    void missingTranscriptReadsAsNull() {
        when(meetingRepository.findById(10L)).thenReturn(Optional.of(meeting));
        when(transcriptRepository.findByMeetingId(10L)).thenReturn(Optional.empty());

        assertThat(transcriptService.getTranscriptByMeetingId(1L, 10L)).isNull();
    }

    @Test
    void otherUsersCannotReadTheTranscript() {
        when(meetingRepository.findById(10L)).thenReturn(Optional.of(meeting));

        assertThatThrownBy(() -> transcriptService.getTranscriptByMeetingId(2L, 10L))
                .isInstanceOf(SecurityException.class);
    }
}
