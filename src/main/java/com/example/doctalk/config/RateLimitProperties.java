package com.example.doctalk.config;

import com.example.doctalk.model.RateOperation;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rate-limit budgets, bound from {@code app.rate-limit.*}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    /**
     * Counter backend: "redis" (shared across instances) or "memory" (single node, local runs).
     */
    private String store = "redis";

    /**
     * Prefix for counter keys in Redis.
     */
    private String keyPrefix = "doctalk:ratelimit";

    /**
     * Budgets keyed by {@link RateOperation#key()}.
     */
    private Map<String, Budget> operations = defaultBudgets();

    public Budget budgetFor(RateOperation operation) {
        Budget budget = operations.get(operation.key());
        if (budget == null) {
            throw new IllegalStateException("No rate-limit budget configured for " + operation.key());
        }
        return budget;
    }

    private static Map<String, Budget> defaultBudgets() {
        Map<String, Budget> budgets = new LinkedHashMap<>();
        budgets.put(RateOperation.CHAT.key(), new Budget(50, Duration.ofMinutes(30)));
        budgets.put(RateOperation.UPLOAD.key(), new Budget(10, Duration.ofMinutes(30)));
        budgets.put(RateOperation.GRAPH_READ.key(), new Budget(100, Duration.ofMinutes(30)));
        return budgets;
    }

    @Data
    public static class Budget {
        private int limit;
        private Duration window;

        public Budget() {
        }

        public Budget(int limit, Duration window) {
            this.limit = limit;
            this.window = window;
        }
    }
}
