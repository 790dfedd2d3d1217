package com.example.doctalk.repository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-node counter store for local runs and tests. Atomicity comes from
 * {@link ConcurrentHashMap#compute}, which locks the key's bin for the whole update.
 */
@Repository
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "memory")
public class InMemoryRateWindowStore implements RateWindowStore {

    private final Map<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    @Override
    public WindowState tryAcquire(String key, int limit, Duration window, Instant now) {
        long nowMs = now.toEpochMilli();
        long cutoff = nowMs - window.toMillis();
        AtomicReference<WindowState> state = new AtomicReference<>();

        windows.compute(key, (k, old) -> {
            Deque<Long> attempts = old != null ? old : new ArrayDeque<>();
            while (!attempts.isEmpty() && attempts.peekFirst() <= cutoff) {
                attempts.pollFirst();
            }
            boolean acquired = attempts.size() < limit;
            if (acquired) {
                attempts.addLast(nowMs);
            }
            long oldest = attempts.isEmpty() ? nowMs : attempts.peekFirst();
            state.set(new WindowState(acquired, attempts.size(), Instant.ofEpochMilli(oldest)));
            return attempts;
        });

        return state.get();
    }
}
