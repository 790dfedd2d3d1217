package com.example.doctalk.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one admission attempt.
 *
 * @param allowed   whether the attempt was counted and may proceed
 * @param remaining attempts left in the current window
 * @param limit     window capacity
 * @param resetAt   when the oldest counted attempt leaves the window
 */
public record RateDecision(
        boolean allowed,
        int remaining,
        int limit,
        Instant resetAt
) {
    /**
     * Whole seconds until {@link #resetAt()}, never below 1 for a rejection.
     */
    public long retryAfterSeconds(Instant now) {
        long millis = Duration.between(now, resetAt).toMillis();
        long seconds = (long) Math.ceil(millis / 1000.0);
        return Math.max(1, seconds);
    }
}
