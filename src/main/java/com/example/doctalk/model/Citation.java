package com.example.doctalk.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Locale;

/**
 * Source attribution appended to a streamed answer.
 * <p>
 * Serialized as {@code {"filename": "...", "similarity": "91.2", "preview": "..."}}; the
 * similarity travels as a stringified percentage with one decimal.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Citation(
        String filename,
        String similarity,
        String preview
) {

    /**
     * Build a citation from a cosine score in [0, 1].
     */
    public static Citation of(String filename, double score, String preview) {
        double pct = Math.max(0.0, Math.min(1.0, score)) * 100.0;
        return new Citation(filename, String.format(Locale.US, "%.1f", pct), preview);
    }

    /**
     * Similarity as a number, 0 when the wire value is missing or malformed.
     */
    public double similarityPct() {
        if (similarity == null || similarity.isBlank()) {
            return 0.0;
        }
        try {
            return Double.parseDouble(similarity.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
