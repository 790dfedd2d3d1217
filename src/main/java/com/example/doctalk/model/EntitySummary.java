package com.example.doctalk.model;

/**
 * @param label  entity label
 * @param type   entity type, e.g. PERSON or ORGANIZATION
 * @param degree number of edges touching the entity across the whole workspace
 */
public record EntitySummary(
        String label,
        String type,
        long degree
) {
}
