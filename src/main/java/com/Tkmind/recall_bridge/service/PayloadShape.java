package com.Tkmind.recall_bridge.service;

import java.util.List;
import java.util.Map;

/**
 * The transcript artifact layouts Recall.ai has been seen to return. Decided by
 * looking at which keys are present, not by where the payload came from.
 */
public enum PayloadShape {

    /** A bare string: transcript text only. */
    PLAIN_TEXT,

    /** {"transcript": "...", "words": [...], "speakers": [...]} */
    TRANSCRIPT_OBJECT,

    /** [{"text" | "transcript": "...", "words": [...]}, ...] */
    TEXT_SEGMENTS,

    /** [{"participant": {...}, "words": [...]}, ...] */
    PARTICIPANT_SEGMENTS,

    /** Anything else, including null and empty arrays. Normalizes to an empty transcript. */
    UNRECOGNIZED;

    public static PayloadShape detect(Object raw) {
        if (raw instanceof String) {
            return PLAIN_TEXT;
        }
        if (raw instanceof Map<?, ?> map) {
            return map.get("transcript") != null ? TRANSCRIPT_OBJECT : UNRECOGNIZED;
        }
        if (raw instanceof List<?> list) {
            Object first = list.stream().filter(item -> item != null).findFirst().orElse(null);
            if (!(first instanceof Map<?, ?> segment)) {
                return UNRECOGNIZED;
            }
            if (segment.containsKey("participant") && segment.get("words") instanceof List<?>) {
                return PARTICIPANT_SEGMENTS;
            }
            if (segment.containsKey("text") || segment.containsKey("transcript") || segment.containsKey("words")) {
                return TEXT_SEGMENTS;
            }
        }
        return UNRECOGNIZED;
    }
}
