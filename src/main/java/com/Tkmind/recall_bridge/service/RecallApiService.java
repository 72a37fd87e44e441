package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.config.RecallConfig;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import com.Tkmind.recall_bridge.dto.recall.RecallBotCreateRequest;
import com.Tkmind.recall_bridge.exception.RecallApiException;
import com.Tkmind.recall_bridge.exception.RecallTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * Thin wrapper over the Recall.ai bot API. Every call is bounded by the
 * RestTemplate's connect/read timeouts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecallApiService {

    private final RestTemplate restTemplate;
    private final RecallConfig recallConfig;
    private final ObjectMapper objectMapper;

    // ─────────────────────────────────────────────
    // Create Bot
    // ─────────────────────────────────────────────

    public RecallBot createBot(RecallBotCreateRequest request) {
        log.info("Creating Recall.ai bot for {}", request.getMeetingUrl());

        RecallBot bot = execute("bot creation", () -> restTemplate.exchange(
                recallConfig.getApi().resolveBaseUrl() + "/bot",
                HttpMethod.POST,
                new HttpEntity<>(request, jsonHeaders()),
                RecallBot.class
        ).getBody());

        if (bot == null || bot.getId() == null) {
            throw new RecallApiException(502, "Recall.ai bot creation failed: empty response");
        }
        log.info("Recall.ai bot {} created", bot.getId());
        return bot;
    }

    // ─────────────────────────────────────────────
    // Get Bot
    // ─────────────────────────────────────────────

    public RecallBot getBot(String botId) {
        RecallBot bot = execute("get bot " + botId, () -> restTemplate.exchange(
                recallConfig.getApi().resolveBaseUrl() + "/bot/{id}",
                HttpMethod.GET,
                new HttpEntity<>(jsonHeaders()),
                RecallBot.class,
                botId
        ).getBody());

        if (bot == null) {
            throw new RecallApiException(502, "Failed to get bot " + botId + ": empty response");
        }
        return bot;
    }

    // ─────────────────────────────────────────────
    // List Bots
    // ─────────────────────────────────────────────

    public List<RecallBot> listBots() {
        JsonNode body = execute("list bots", () -> restTemplate.exchange(
                recallConfig.getApi().resolveBaseUrl() + "/bot",
                HttpMethod.GET,
                new HttpEntity<>(jsonHeaders()),
                JsonNode.class
        ).getBody());

        if (body == null || !body.has("results")) {
            return List.of();
        }
        return objectMapper.convertValue(body.get("results"), new TypeReference<List<RecallBot>>() {});
    }

    // ─────────────────────────────────────────────
    // Fetch Raw Transcript
    // ─────────────────────────────────────────────

    /**
     * Downloads the transcript artifact. The download URL is pre-signed, so no
     * API token is sent. Returns a String, Map or List depending on what the
     * artifact holds; see {@link TranscriptNormalizer}.
     *
     * <p>Read as bytes: storage URLs often answer with octet-stream or a text
     * type without charset, and the artifact is UTF-8 either way.
     */
    public Object fetchRawTranscript(String downloadUrl) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_PLAIN, MediaType.ALL));

        byte[] body = execute("transcript download", () -> restTemplate.exchange(
                URI.create(downloadUrl),
                HttpMethod.GET,
                new HttpEntity<>(headers),
                byte[].class
        ).getBody());

        if (body == null) {
            return null;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(body, Object.class);
        } catch (IOException e) {
            log.debug("Transcript artifact is not JSON, treating as plain text ({} chars)", text.length());
            return text;
        }
    }

    // ─────────────────────────────────────────────
    // Core Executor
    // ─────────────────────────────────────────────

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (HttpStatusCodeException e) {
            String detail = extractErrorMessage(e.getResponseBodyAsString());
            log.error("Recall.ai HTTP error {} during {}: {}", e.getStatusCode().value(), operation, detail);
            throw new RecallApiException(e.getStatusCode().value(),
                    "Recall.ai " + operation + " failed: " + (detail != null ? detail : e.getStatusText()));
        } catch (ResourceAccessException e) {
            log.warn("Recall.ai {} timed out or was unreachable: {}", operation, e.getMessage());
            throw new RecallTimeoutException("Recall.ai " + operation + " timed out", e);
        }
    }

    /**
     * Recall.ai puts the human readable reason in "message" or "detail".
     */
    private String extractErrorMessage(String responseBody) {
        if (responseBody == null || responseBody.isBlank()) return null;
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            for (String key : new String[]{"message", "detail"}) {
                JsonNode value = node.get(key);
                if (value != null && !value.isNull()) {
                    return value.isTextual() ? value.asText() : value.toString();
                }
            }
        } catch (JsonProcessingException e) {
            log.debug("Recall.ai error body is not JSON");
        }
        return responseBody;
    }

    private HttpHeaders jsonHeaders() {
        String apiKey = recallConfig.getApi().getApiKey();

        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Recall.ai API key not configured. Set RECALL_AI_API_KEY.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HttpHeaders.AUTHORIZATION, "Token " + apiKey);
        return headers;
    }
}
