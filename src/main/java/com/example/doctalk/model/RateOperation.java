package com.example.doctalk.model;

/**
 * Operations with an independent rate-limit budget.
 */
public enum RateOperation {
    CHAT("chat"),
    UPLOAD("upload"),
    GRAPH_READ("graph-read");

    private final String key;

    RateOperation(String key) {
        this.key = key;
    }

    /**
     * Stable name used in configuration and counter keys.
     */
    public String key() {
        return key;
    }
}
