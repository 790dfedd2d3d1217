package com.example.doctalk.repository;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRateWindowStoreTest {

    private static final Duration WINDOW = Duration.ofMinutes(1);
    private static final Instant T0 = Instant.parse("2024-05-01T12:00:00Z");

    private final InMemoryRateWindowStore store = new InMemoryRateWindowStore();

    @Test
    void tryAcquire_windowSlides_oldAttemptsExpire() {
        assertThat(store.tryAcquire("k", 2, WINDOW, T0).acquired()).isTrue();
        assertThat(store.tryAcquire("k", 2, WINDOW, T0.plusSeconds(30)).acquired()).isTrue();
        assertThat(store.tryAcquire("k", 2, WINDOW, T0.plusSeconds(45)).acquired()).isFalse();

        // the first attempt leaves the window exactly one minute later
        RateWindowStore.WindowState state = store.tryAcquire("k", 2, WINDOW, T0.plusSeconds(60));
        assertThat(state.acquired()).isTrue();
        assertThat(state.count()).isEqualTo(2);
        assertThat(state.oldest()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    void tryAcquire_rejectedAttempt_isNotCounted() {
        store.tryAcquire("k", 1, WINDOW, T0);
        RateWindowStore.WindowState rejected = store.tryAcquire("k", 1, WINDOW, T0.plusSeconds(1));

        assertThat(rejected.acquired()).isFalse();
        assertThat(rejected.count()).isEqualTo(1);
        assertThat(rejected.oldest()).isEqualTo(T0);
    }

    @Test
    void tryAcquire_concurrentAttempts_neverExceedLimit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                attempts.add(() -> store.tryAcquire("shared", 50, WINDOW, T0).acquired());
            }
            long admitted = 0;
            for (Future<Boolean> f : pool.invokeAll(attempts)) {
                if (f.get()) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(50);
        } finally {
            pool.shutdownNow();
        }
    }
}
