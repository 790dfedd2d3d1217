package com.example.doctalk.repository;

import java.time.Duration;
import java.time.Instant;

/**
 * Shared sliding-window counters. Implementations must make {@link #tryAcquire} a single atomic
 * read-modify-write per key.
 */
public interface RateWindowStore {

    /**
     * Drop attempts older than {@code window}, then record this attempt if fewer than
     * {@code limit} remain.
     *
     * @return the window after the attempt
     * @throws com.example.doctalk.exception.RateGateUnavailableException if the backend cannot be reached
     */
    WindowState tryAcquire(String key, int limit, Duration window, Instant now);

    /**
     * @param acquired whether this attempt was counted
     * @param count    attempts inside the window, this one included when acquired
     * @param oldest   timestamp of the oldest counted attempt, or now when the window is empty
     */
    record WindowState(boolean acquired, int count, Instant oldest) {
    }
}
