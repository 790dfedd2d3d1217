package com.example.doctalk.repository;

import com.example.doctalk.exception.RateGateUnavailableException;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Sliding-window log kept in a Redis sorted set per key; scores are attempt timestamps.
 * The whole check-and-record runs inside one Lua script, so concurrent attempts from the same
 * user are serialized by Redis.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.rate-limit", name = "store", havingValue = "redis", matchIfMissing = true)
public class RedisRateWindowStore implements RateWindowStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<String> slidingWindowScript;

    @Override
    public WindowState tryAcquire(String key, int limit, Duration window, Instant now) {
        long nowMs = now.toEpochMilli();
        String member = nowMs + ":" + UUID.randomUUID();

        String result;
        try {
            result = redisTemplate.execute(slidingWindowScript, List.of(key),
                    String.valueOf(nowMs),
                    String.valueOf(window.toMillis()),
                    String.valueOf(limit),
                    member);
        } catch (DataAccessException e) {
            throw new RateGateUnavailableException(e);
        }

        return parse(result);
    }

    /**
     * Script replies look like {@code "1:3:1700000000000"}: acquired flag, count, oldest attempt.
     */
    static WindowState parse(String result) {
        String[] parts = result == null ? new String[0] : result.split(":");
        if (parts.length != 3) {
            throw new RateGateUnavailableException(
                    new IllegalStateException("Unexpected sliding window script result: " + result));
        }
        try {
            boolean acquired = Long.parseLong(parts[0]) == 1L;
            int count = Integer.parseInt(parts[1]);
            Instant oldest = Instant.ofEpochMilli(Long.parseLong(parts[2]));
            return new WindowState(acquired, count, oldest);
        } catch (NumberFormatException e) {
            throw new RateGateUnavailableException(e);
        }
    }
}
