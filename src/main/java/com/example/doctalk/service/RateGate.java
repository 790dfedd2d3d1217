package com.example.doctalk.service;

import com.example.doctalk.config.RateLimitProperties;
import com.example.doctalk.exception.RateLimitExceededException;
import com.example.doctalk.model.RateDecision;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.repository.RateWindowStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-user, per-operation sliding-window admission control.
 * <p>
 * Every attempt goes through the shared {@link RateWindowStore}; when that store is unreachable
 * the attempt is rejected with {@link com.example.doctalk.exception.RateGateUnavailableException}
 * instead of being let through uncounted.
 */
@Service
@RequiredArgsConstructor
public class RateGate {

    private static final Logger log = LoggerFactory.getLogger(RateGate.class);

    private final RateWindowStore store;
    private final RateLimitProperties properties;
    private final Clock clock;

    public RateDecision admit(String userId, RateOperation operation) {
        RateLimitProperties.Budget budget = properties.budgetFor(operation);
        Instant now = clock.instant();

        RateWindowStore.WindowState state = store.tryAcquire(
                key(userId, operation), budget.getLimit(), budget.getWindow(), now);

        int remaining = Math.max(0, budget.getLimit() - state.count());
        Instant resetAt = state.oldest().plus(budget.getWindow());
        RateDecision decision = new RateDecision(state.acquired(), remaining, budget.getLimit(), resetAt);

        if (decision.allowed()) {
            log.debug("Rate limit: {}/{} {} requests remaining for user {}",
                    remaining, budget.getLimit(), operation.key(), userId);
        } else {
            log.info("Rate limit exceeded for user {} on {} ({} per {}), resets at {}",
                    userId, operation.key(), budget.getLimit(), budget.getWindow(), resetAt);
        }
        return decision;
    }

    /**
     * Admit or throw {@link RateLimitExceededException}.
     */
    public RateDecision require(String userId, RateOperation operation) {
        RateDecision decision = admit(userId, operation);
        if (!decision.allowed()) {
            throw new RateLimitExceededException(operation, decision, clock.instant());
        }
        return decision;
    }

    private String key(String userId, RateOperation operation) {
        return properties.getKeyPrefix() + ":" + operation.key() + ":" + userId;
    }
}
