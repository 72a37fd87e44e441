package com.Tkmind.recall_bridge.controller;

import com.Tkmind.recall_bridge.dto.request.BotCreateRequest;
import com.Tkmind.recall_bridge.dto.response.BotResponse;
import com.Tkmind.recall_bridge.dto.response.BotStatusResponse;
import com.Tkmind.recall_bridge.service.BotService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Recording bot endpoints.
 * All requests require header:  X-User-Id: 42
 *
 * POST   /api/bots                 send (or reuse) a bot for a meeting
 * GET    /api/bots/{botId}         check the bot now, storing the transcript if ready
 * DELETE /api/bots/{botId}         stop tracking the bot
 */
@RestController
@RequestMapping("/bots")
@RequiredArgsConstructor
@Slf4j
public class BotController {

    private final BotService botService;

    @PostMapping
    public ResponseEntity<BotResponse> createBot(
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody BotCreateRequest request) {

        BotResponse response = botService.ensureBot(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{botId}")
    public ResponseEntity<BotStatusResponse> checkBot(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable String botId) {

        return ResponseEntity.ok(botService.checkBot(botId, userId));
    }

    @DeleteMapping("/{botId}")
    public ResponseEntity<Void> removeBot(
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable String botId) {

        botService.removeBot(botId, userId);
        return ResponseEntity.noContent().build();
    }
}
