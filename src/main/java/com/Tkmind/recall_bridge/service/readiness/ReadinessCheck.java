package com.Tkmind.recall_bridge.service.readiness;

import com.Tkmind.recall_bridge.dto.recall.NormalizedTranscript;
import com.Tkmind.recall_bridge.dto.recall.RecallBot;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One signal for "is the transcript of this finished bot retrievable".
 * Checks run in {@link org.springframework.core.annotation.Order} order and the
 * first one that answers something other than UNKNOWN wins.
 */
public interface ReadinessCheck {

    String name();

    /**
     * @param bot snapshot of a bot whose effective status is done or call_ended
     */
    Result check(RecallBot bot);

    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    final class Result {
        private final ReadinessVerdict verdict;

        /** Set when the check had to download the transcript to decide. */
        private final NormalizedTranscript transcript;

        public static Result ready() {
            return new Result(ReadinessVerdict.READY, null);
        }

        public static Result ready(NormalizedTranscript transcript) {
            return new Result(ReadinessVerdict.READY, transcript);
        }

        public static Result notReady() {
            return new Result(ReadinessVerdict.NOT_READY, null);
        }

        public static Result unknown() {
            return new Result(ReadinessVerdict.UNKNOWN, null);
        }
    }
}
