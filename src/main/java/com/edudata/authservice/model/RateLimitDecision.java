package com.edudata.authservice.model;

import java.time.Duration;

public sealed interface RateLimitDecision {

    record Allowed() implements RateLimitDecision {}

    record Limited(Duration retryAfter) implements RateLimitDecision {

        /** Whole minutes, rounded up, never below one. */
        public long retryAfterMinutes() {
            long seconds = Math.max(retryAfter.getSeconds(), 0);
            return Math.max(1, (seconds + 59) / 60);
        }
    }

    static RateLimitDecision allowed() {
        return new Allowed();
    }

    static RateLimitDecision limited(Duration retryAfter) {
        return new Limited(retryAfter);
    }
}
