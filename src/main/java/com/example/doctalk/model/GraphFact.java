package com.example.doctalk.model;

/**
 * One directed, labeled edge of the user's knowledge graph.
 */
public record GraphFact(
        String subject,
        String subjectType,
        String relationship,
        String object,
        String objectType
) {
}
