package com.Tkmind.recall_bridge.service;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript.Speaker;
import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript.Word;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a raw Recall.ai transcript artifact into a {@link NormalizedTranscript}.
 * Never throws on content: an unknown or empty payload yields an empty transcript,
 * which the poller reads as "try again later".
 */
@Component
@Slf4j
public class TranscriptNormalizer {

    public NormalizedTranscript normalize(Object raw) {
        PayloadShape shape = PayloadShape.detect(raw);
        log.debug("Normalizing transcript payload shape={}", shape);

        return switch (shape) {
            case PLAIN_TEXT -> NormalizedTranscript.builder().text((String) raw).build();
            case TRANSCRIPT_OBJECT -> fromTranscriptObject((Map<?, ?>) raw);
            case TEXT_SEGMENTS -> fromTextSegments((List<?>) raw);
            case PARTICIPANT_SEGMENTS -> fromParticipantSegments((List<?>) raw);
            case UNRECOGNIZED -> NormalizedTranscript.empty();
        };
    }

    // ── {transcript, words, speakers} ────────────────────────────────────────

    private NormalizedTranscript fromTranscriptObject(Map<?, ?> payload) {
        List<Word> words = new ArrayList<>();
        if (payload.get("words") instanceof List<?> rawWords) {
            for (Object rawWord : rawWords) {
                if (rawWord instanceof Map<?, ?> wordMap) {
                    words.add(toWord(wordMap));
                }
            }
        }

        List<Speaker> speakers = new ArrayList<>();
        if (payload.get("speakers") instanceof List<?> rawSpeakers) {
            for (Object rawSpeaker : rawSpeakers) {
                if (rawSpeaker instanceof Map<?, ?> speakerMap && speakerMap.get("id") != null) {
                    String id = String.valueOf(speakerMap.get("id"));
                    speakers.add(new Speaker(id, nameOrDefault(speakerMap.get("name"), id)));
                }
            }
        }

        return NormalizedTranscript.builder()
                .text(String.valueOf(payload.get("transcript")))
                .words(words)
                .speakers(speakers)
                .build();
    }

    // ── [{text | transcript, words}] ─────────────────────────────────────────

    private NormalizedTranscript fromTextSegments(List<?> segments) {
        List<String> parts = new ArrayList<>();
        List<Word> words = new ArrayList<>();

        for (Object item : segments) {
            if (!(item instanceof Map<?, ?> segment)) continue;

            Object text = segment.get("text") != null ? segment.get("text") : segment.get("transcript");
            if (text instanceof String s && !s.isBlank()) {
                parts.add(s);
            }
            if (segment.get("words") instanceof List<?> rawWords) {
                for (Object rawWord : rawWords) {
                    if (rawWord instanceof Map<?, ?> wordMap) {
                        words.add(toWord(wordMap));
                    }
                }
            }
        }

        return NormalizedTranscript.builder()
                .text(String.join(" ", parts))
                .words(words)
                .build();
    }

    // ── [{participant, words}] ───────────────────────────────────────────────

    /*
     * Text is rebuilt from the words rather than from any segment-level text so
     * that text and word list always agree.
     */
    private NormalizedTranscript fromParticipantSegments(List<?> segments) {
        Map<String, Speaker> speakersById = new LinkedHashMap<>();
        List<Word> words = new ArrayList<>();
        List<String> parts = new ArrayList<>();

        for (Object item : segments) {
            if (!(item instanceof Map<?, ?> segment)) continue;

            if (segment.get("participant") instanceof Map<?, ?> participant && participant.get("id") != null) {
                String id = String.valueOf(participant.get("id"));
                speakersById.putIfAbsent(id, new Speaker(id, nameOrDefault(participant.get("name"), id)));
            }

            if (segment.get("words") instanceof List<?> rawWords) {
                for (Object rawWord : rawWords) {
                    if (!(rawWord instanceof Map<?, ?> wordMap)) continue;
                    Word word = toWord(wordMap);
                    if (word.getText() == null || word.getText().isBlank()) continue;
                    words.add(word);
                    parts.add(word.getText());
                }
            }
        }

        return NormalizedTranscript.builder()
                .text(String.join(" ", parts))
                .words(words)
                .speakers(new ArrayList<>(speakersById.values()))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    /**
     * Accepts both flat seconds (start_time/end_time) and the participant
     * layout's {start_timestamp: {relative}} objects.
     */
    private Word toWord(Map<?, ?> wordMap) {
        Object text = wordMap.get("text");
        double start = firstNumber(wordMap.get("start_time"), relative(wordMap.get("start_timestamp")));
        double end = firstNumber(wordMap.get("end_time"), relative(wordMap.get("end_timestamp")));
        return new Word(text != null ? text.toString() : null, start, end);
    }

    private Object relative(Object timestamp) {
        return timestamp instanceof Map<?, ?> map ? map.get("relative") : null;
    }

    private double firstNumber(Object... candidates) {
        for (Object candidate : candidates) {
            if (candidate instanceof Number number) {
                return number.doubleValue();
            }
            if (candidate instanceof String s && !s.isBlank()) {
                try {
                    return Double.parseDouble(s);
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric timestamp '{}'", s);
                }
            }
        }
        return 0d;
    }

    private String nameOrDefault(Object name, String id) {
        return name instanceof String s && !s.isBlank() ? s : "Speaker " + id;
    }
}
