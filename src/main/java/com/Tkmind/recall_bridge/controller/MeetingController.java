package com.Tkmind.recall_bridge.controller;

import com.Tkmind.recall_bridge.dto.request.MeetingScheduleRequest;
import com.Tkmind.recall_bridge.dto.response.MeetingResponse;
import com.Tkmind.recall_bridge.service.MeetingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Meeting endpoints.
 * All requests require header:  X-User-Id: 42
 *
 * POST   /api/meetings             register a meeting
 * GET    /api/meetings             list the user's meetings
 * GET    /api/meetings/{id}        get a single meeting
 */
@RestController
@RequestMapping("/meetings")
@RequiredArgsConstructor
@Slf4j
public class MeetingController {

    private final MeetingService meetingService;

    @PostMapping
    public ResponseEntity<MeetingResponse> scheduleMeeting(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody MeetingScheduleRequest request) {

        MeetingResponse response = meetingService.scheduleMeeting(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<MeetingResponse>> getUserMeetings(
            @RequestHeader("X-User-Id") Long userId) {

        return ResponseEntity.ok(meetingService.getUserMeetings(userId));
    }

    @GetMapping("/{meetingId}")
    public ResponseEntity<MeetingResponse> getMeetingById(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable Long meetingId) {

        return ResponseEntity.ok(meetingService.getMeetingById(userId, meetingId));
    }
}
