package com.Tkmind.recall_bridge.controller;

import com.Tkmind.recall_bridge.dto.response.TranscriptResponse;
import com.Tkmind.recall_bridge.service.TranscriptService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/meetings")
@RequiredArgsConstructor
@Slf4j
public class TranscriptController {

    private final TranscriptService transcriptService;

    @GetMapping("/{meetingId}/transcript")
    public ResponseEntity<TranscriptResponse> getTranscript(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long meetingId) {

        TranscriptResponse transcript =
                transcriptService.getTranscriptByMeetingId(userId, meetingId);

        if (transcript == null) {
            log.debug("Transcript not ready yet for meeting {}", meetingId);
            return ResponseEntity.accepted().build(); // 202
        }

        return ResponseEntity.ok(transcript);
    }
}
