package com.Tkmind.recall_bridge.controller;

import com.Tkmind.recall_bridge.dto.request.MeetingScheduleRequest;
import com.Tkmind.recall_bridge.dto.response.MeetingResponse;
import com.Tkmind.recall_bridge.dto.response.TranscriptResponse;
import com.Tkmind.recall_bridge.service.MeetingService;
import com.Tkmind.recall_bridge.service.TranscriptService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {MeetingController.class, TranscriptController.class})
class MeetingControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private MeetingService meetingService;

    @MockitoBean
    private TranscriptService transcriptService;

    @Test
    void registersMeeting() throws Exception {
        when(meetingService.scheduleMeeting(eq(1L), any(MeetingScheduleRequest.class)))
                .thenReturn(MeetingResponse.builder().id(10L).title("Standup").platform("meet").status("SCHEDULED").build());

        mockMvc.perform(post("/meetings")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Standup", "startTime": "2030-01-01T10:00:00",
                                 "meetingUrl": "https://meet.google.com/abc-defg-hij"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(10))
                .andExpect(jsonPath("$.platform").value("meet"));
    }

    @Test
    void meetingWithoutTitleIsRejected() throws Exception {
        mockMvc.perform(post("/meetings")
                        .header("X-User-Id", "1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"startTime\": \"2030-01-01T10:00:00\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void nonNumericUserIdIsRejected() throws Exception {
        mockMvc.perform(get("/meetings").header("X-User-Id", "abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void listsMeetings() throws Exception {
        when(meetingService.getUserMeetings(1L)).thenReturn(List.of(
                MeetingResponse.builder().id(10L).build(),
                MeetingResponse.builder().id(11L).build()));

        mockMvc.perform(get("/meetings").header("X-User-Id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void transcriptNotCollectedYetIsAccepted() throws Exception {
        when(transcriptService.getTranscriptByMeetingId(1L, 10L)).thenReturn(null);

        mockMvc.perform(get("/meetings/10/transcript").header("X-User-Id", "1"))
                .andExpect(status().isAccepted());
    }

    @Test
    void storedTranscriptIsReturned() throws Exception {
        when(transcriptService.getTranscriptByMeetingId(1L, 10L)).thenReturn(TranscriptResponse.builder()
                .meetingId(10L).botId("bot-1").content("Hi").duration(0).build());

        mockMvc.perform(get("/meetings/10/transcript").header("X-User-Id", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").value("Hi"))
                .andExpect(jsonPath("$.botId").value("bot-1"));
    }
}
