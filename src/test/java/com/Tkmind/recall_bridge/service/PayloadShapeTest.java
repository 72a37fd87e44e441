package com.Tkmind.recall_bridge.service;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadShapeTest {

    @Test
    void detectsShapeFromKeys() {
        assertThat(PayloadShape.detect("text")).isEqualTo(PayloadShape.PLAIN_TEXT);
        assertThat(PayloadShape.detect(Map.of("transcript", "x"))).isEqualTo(PayloadShape.TRANSCRIPT_OBJECT);
        assertThat(PayloadShape.detect(List.of(Map.of("text", "x")))).isEqualTo(PayloadShape.TEXT_SEGMENTS);
        assertThat(PayloadShape.detect(List.of(Map.of("participant", Map.of(), "words", List.of()))))
                .isEqualTo(PayloadShape.PARTICIPANT_SEGMENTS);
    }

    @Test
    void skipsLeadingNullsWhenInspectingSegments() {
        assertThat(PayloadShape.detect(Arrays.asList(null, Map.of("transcript", "x"))))
                .isEqualTo(PayloadShape.TEXT_SEGMENTS);
    }

    @Test
    void participantWithoutWordListIsNotParticipantShape() {
        assertThat(PayloadShape.detect(List.of(Map.of("participant", Map.of("id", 1), "words", "nope"))))
                .isEqualTo(PayloadShape.TEXT_SEGMENTS);
        assertThat(PayloadShape.detect(List.of(Map.of("participant", Map.of("id", 1)))))
                .isEqualTo(PayloadShape.UNRECOGNIZED);
    }

    @Test
    void everythingElseIsUnrecognized() {
        assertThat(PayloadShape.detect(null)).isEqualTo(PayloadShape.UNRECOGNIZED);
        assertThat(PayloadShape.detect(Map.of("words", List.of()))).isEqualTo(PayloadShape.UNRECOGNIZED);
        assertThat(PayloadShape.detect(List.of())).isEqualTo(PayloadShape.UNRECOGNIZED);
        assertThat(PayloadShape.detect(List.of("a"))).isEqualTo(PayloadShape.UNRECOGNIZED);
    }
}
