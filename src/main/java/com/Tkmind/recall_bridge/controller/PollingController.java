package com.Tkmind.recall_bridge.controller;

import com.Tkmind.recall_bridge.dto.request.PollingActionRequest;
import com.Tkmind.recall_bridge.dto.response.PollSummary;
import com.Tkmind.recall_bridge.dto.response.PollingStatusResponse;
import com.Tkmind.recall_bridge.service.BotPollingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

/**
 * GET  /api/bots/polling            poller status and last tick summary
 * POST /api/bots/polling            {"action": "start" | "stop" | "force-poll"}
 */
@RestController
@RequestMapping("/bots/polling")
@RequiredArgsConstructor
@Slf4j
public class PollingController {

    private final BotPollingService botPollingService;

    @GetMapping
    public ResponseEntity<PollingStatusResponse> getStatus() {
        return ResponseEntity.ok(botPollingService.getStatus());
    }

    @PostMapping
    public ResponseEntity<PollingStatusResponse> control(@Valid @RequestBody PollingActionRequest request) {
        String action = request.getAction().trim().toLowerCase(Locale.ROOT);
        log.info("Polling action '{}' requested", action);

        PollingStatusResponse response;
        switch (action) {
            case "start" -> {
                boolean started = botPollingService.start();
                response = botPollingService.getStatus();
                response.setMessage(started ? "Polling started" : "Polling already running");
            }
            case "stop" -> {
                boolean stopped = botPollingService.stop();
                response = botPollingService.getStatus();
                response.setMessage(stopped ? "Polling stopped" : "Polling was not running");
            }
            case "force-poll" -> {
                PollSummary summary = botPollingService.forceTick();
                response = botPollingService.getStatus();
                response.setLastTick(summary);
                response.setMessage("Polled " + summary.getPolled() + " bot(s)");
            }
            default -> throw new IllegalArgumentException(
                    "Unknown action '" + request.getAction() + "', expected start, stop or force-poll");
        }
        return ResponseEntity.ok(response);
    }
}
