package com.example.doctalk.exception;

import com.example.doctalk.model.RateDecision;
import com.example.doctalk.model.RateOperation;

import java.time.Instant;

/**
 * Thrown when a user has spent the budget of one operation in the current window.
 */
public class RateLimitExceededException extends DocTalkException {

    private final RateOperation operation;
    private final RateDecision decision;
    private final long retryAfterSeconds;

    public RateLimitExceededException(RateOperation operation, RateDecision decision, Instant now) {
        this(operation, decision, decision.retryAfterSeconds(now));
    }

    private RateLimitExceededException(RateOperation operation, RateDecision decision, long retryAfterSeconds) {
        super("Rate limit of " + decision.limit() + " " + operation.key()
                + " requests exceeded. Try again in " + retryAfterSeconds + "s.");
        this.operation = operation;
        this.decision = decision;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public RateOperation getOperation() {
        return operation;
    }

    public RateDecision getDecision() {
        return decision;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
