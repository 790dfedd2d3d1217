package com.example.doctalk.model;

import java.time.Instant;
import java.util.List;

/**
 * @param totalPages at least 1, even for an empty workspace
 */
public record DocumentPage(
        List<Entry> documents,
        int totalPages
) {
    public record Entry(String id, String filename, String status, Instant uploadedAt) {
    }
}
