package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallRecording;
import com.Tkmind.recall_bridge.exception.RecallApiException;
import com.Tkmind.recall_bridge.exception.RecallTimeoutException;
import com.Tkmind.recall_bridge.service.RecallApiService;
import com.Tkmind.recall_bridge.service.TranscriptNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BotReadinessServiceTest {

    @Mock
    private RecallApiService recallApiService;

    private BotReadinessService service;

    @BeforeEach
    void setUp() {
        TranscriptDownloader downloader = new TranscriptDownloader(recallApiService, new TranscriptNormalizer());
        List<ReadinessCheck> checks = List.of(
                new TranscriptStatusCheck(),
                new DownloadUrlCheck(),
                new SpeculativeFetchCheck(recallApiService, downloader));
        service = new BotReadinessService(recallApiService, downloader, checks);
    }

    static RecallBot bot(String id, List<String> history, RecallRecording... recordings) {
        List<RecallBot.StatusChange> changes = new ArrayList<>();
        for (String code : history) {
            changes.add(new RecallBot.StatusChange(code, null, null));
        }
        return RecallBot.builder()
                .id(id)
                .statusChanges(changes)
                .recordings(new ArrayList<>(List.of(recordings)))
                .build();
    }

    static RecallRecording recording(String transcriptCode, String downloadUrl) {
        RecallRecording.MediaShortcut transcript = new RecallRecording.MediaShortcut(
                transcriptCode != null ? new RecallRecording.ShortcutStatus(transcriptCode) : null,
                downloadUrl != null ? new RecallRecording.ShortcutData(downloadUrl) : null);
        return RecallRecording.builder()
                .id("rec-1")
                .mediaShortcuts(new RecallRecording.MediaShortcuts(transcript, null))
                .build();
    }

    @Test
    void callEndedWithoutRecordingsIsReadyWithoutTranscript() {
        when(recallApiService.getBot("bot-1"))
                .thenReturn(bot("bot-1", List.of("starting", "joining_call", "call_ended")));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.isHasTranscript()).isFalse();
        assertThat(readiness.isFailed()).isFalse();
        assertThat(readiness.getStatus()).isEqualTo("call_ended");
        verify(recallApiService, times(1)).getBot("bot-1");
        verify(recallApiService, never()).fetchRawTranscript(anyString());
    }

    @Test
    void latestStatusChangeWinsOverTopLevelStatus() {
        RecallBot bot = bot("bot-1", List.of("joining_call", "done"));
        bot.setStatus("in_call_recording");
        when(recallApiService.getBot("bot-1")).thenReturn(bot);

        assertThat(service.check("bot-1").getStatus()).isEqualTo("done");
    }

    @Test
    void transcriptStatusDoneMeansTranscriptAvailable() {
        when(recallApiService.getBot("bot-1"))
                .thenReturn(bot("bot-1", List.of("done"), recording("done", "https://dl.test/t1")));
        when(recallApiService.fetchRawTranscript("https://dl.test/t1")).thenReturn(List.of(Map.of(
                "participant", Map.of("id", 7, "name", "Ana"),
                "words", List.of(Map.of(
                        "text", "Hi",
                        "start_timestamp", Map.of("relative", 0),
                        "end_timestamp", Map.of("relative", 0.5))))));

        BotReadiness readiness = service.check("bot-1");
        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.isHasTranscript()).isTrue();
        assertThat(readiness.getTranscript()).isNull();

        Optional<NormalizedTranscript> transcript = service.fetchTranscript(readiness);
        assertThat(transcript).isPresent();
        assertThat(transcript.get().getText()).isEqualTo("Hi");
        assertThat(transcript.get().durationMinutes()).isZero();
    }

    @Test
    void exposedDownloadUrlMeansTranscriptAvailableEvenWhileProcessing() {
        when(recallApiService.getBot("bot-1"))
                .thenReturn(bot("bot-1", List.of("call_ended"), recording("processing", "https://dl.test/t1")));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isHasTranscript()).isTrue();
        verify(recallApiService, never()).fetchRawTranscript(anyString());
    }

    @Test
    void speculativeFetchRereadsTheBotAndReusesTheDownloadedTranscript() {
        RecallBot stale = bot("bot-1", List.of("done"), recording(null, null));
        RecallBot fresh = bot("bot-1", List.of("done"), recording(null, "https://dl.test/late"));
        when(recallApiService.getBot("bot-1")).thenReturn(stale, fresh);
        when(recallApiService.fetchRawTranscript("https://dl.test/late")).thenReturn("late transcript");

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isHasTranscript()).isTrue();
        assertThat(service.fetchTranscript(readiness).orElseThrow().getText()).isEqualTo("late transcript");
        verify(recallApiService, times(2)).getBot("bot-1");
        verify(recallApiService, times(1)).fetchRawTranscript("https://dl.test/late");
    }

    @Test
    void speculativeFetchWithEmptyTextIsNotReady() {
        RecallBot stale = bot("bot-1", List.of("done"), recording(null, null));
        RecallBot fresh = bot("bot-1", List.of("done"), recording(null, "https://dl.test/empty"));
        when(recallApiService.getBot("bot-1")).thenReturn(stale, fresh);
        when(recallApiService.fetchRawTranscript("https://dl.test/empty")).thenReturn(null);

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.isHasTranscript()).isFalse();
    }

    @Test
    void speculativeFetchFailureIsNotReadyRatherThanAnError() {
        RecallBot stale = bot("bot-1", List.of("done"), recording(null, null));
        when(recallApiService.getBot("bot-1"))
                .thenReturn(stale)
                .thenThrow(new RecallApiException(500, "boom"));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.isHasTranscript()).isFalse();
    }

    @Test
    void errorStatusIsFailedAndNotReady() {
        when(recallApiService.getBot("bot-1")).thenReturn(bot("bot-1", List.of("joining_call", "error")));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isFalse();
        assertThat(readiness.isFailed()).isTrue();
    }

    @Test
    void inProgressStatusIsNotReady() {
        when(recallApiService.getBot("bot-1")).thenReturn(bot("bot-1", List.of("in_call_recording")));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isFalse();
        assertThat(readiness.isFailed()).isFalse();
        assertThat(readiness.getStatus()).isEqualTo("in_call_recording");
    }

    @Test
    void onceReadyTheBotStaysReady() {
        when(recallApiService.getBot("bot-1")).thenReturn(bot("bot-1", List.of("in_call_recording")));

        BotReadiness readiness = service.check("bot-1", "done");

        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.getStatus()).isEqualTo("done");
    }

    @Test
    void timeoutIsReportedAsNotReadyYet() {
        when(recallApiService.getBot("bot-1")).thenThrow(new RecallTimeoutException("timed out", null));

        BotReadiness readiness = service.check("bot-1");

        assertThat(readiness.isReady()).isFalse();
        assertThat(readiness.isHasTranscript()).isFalse();
        assertThat(readiness.isFailed()).isFalse();
        assertThat(readiness.getBot()).isNull();
    }

    @Test
    void timeoutKeepsAnEarlierReadyStatus() {
        when(recallApiService.getBot("bot-1")).thenThrow(new RecallTimeoutException("timed out", null));

        BotReadiness readiness = service.check("bot-1", "call_ended");

        assertThat(readiness.isReady()).isTrue();
        assertThat(readiness.isHasTranscript()).isFalse();
        assertThat(service.fetchTranscript(readiness)).isEmpty();
    }

    @Test
    void otherProviderErrorsPropagate() {
        when(recallApiService.getBot("bot-1")).thenThrow(new RecallApiException(401, "bad token"));

        assertThatThrownBy(() -> service.check("bot-1"))
                .isInstanceOf(RecallApiException.class)
                .hasMessage("bad token");
    }
}
