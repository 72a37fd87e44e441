package com.Tkmind.recall_bridge.dto.recall;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Canonical transcript, whatever shape Recall.ai delivered it in.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NormalizedTranscript {

    @Builder.Default
    private String text = "";

    @Builder.Default
    private List<Word> words = new ArrayList<>();

    @Builder.Default
    private List<Speaker> speakers = new ArrayList<>();

    public static NormalizedTranscript empty() {
        return NormalizedTranscript.builder().build();
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    /** Whole minutes, rounded, from the last word's end time. 0 without words. */
    public int durationMinutes() {
        if (words == null || words.isEmpty()) return 0;
        Word last = words.get(words.size() - 1);
        if (last == null || Double.isNaN(last.getEndTime())) return 0;
        return (int) Math.round(last.getEndTime() / 60.0);
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Word {
        private String text;
        private double startTime;
        private double endTime;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Speaker {
        private String id;
        private String name;
    }
}
