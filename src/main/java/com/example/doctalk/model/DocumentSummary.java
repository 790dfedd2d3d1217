package com.example.doctalk.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * What the ingestion pipeline extracted from one document: its entities grouped by type,
 * the relationships between them and a few raw text samples.
 */
public record DocumentSummary(
        String id,
        String filename,
        String status,
        Instant uploadedAt,
        Stats stats,
        Map<String, List<Node>> nodesByType,
        List<Relationship> relationships,
        List<String> sampleContent
) {
    public DocumentSummary {
        nodesByType = nodesByType == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(nodesByType));
        relationships = relationships == null ? List.of() : List.copyOf(relationships);
        sampleContent = sampleContent == null ? List.of() : List.copyOf(sampleContent);
    }

    /**
     * Groups {@code nodes} by type, keeping their order within and across groups.
     */
    public static DocumentSummary of(String id, String filename, String status, Instant uploadedAt,
                                     List<Node> nodes, List<Relationship> relationships, List<String> sampleContent) {
        Map<String, List<Node>> byType = nodes.stream()
                .collect(Collectors.groupingBy(Node::type, LinkedHashMap::new, Collectors.toList()));
        Stats stats = new Stats(nodes.size(), relationships.size(), byType.size());
        return new DocumentSummary(id, filename, status, uploadedAt, stats, byType, relationships, sampleContent);
    }

    public record Stats(int totalNodes, int totalEdges, int nodeTypes) {
    }

    public record Node(String id, String label, String type) {
    }

    public record Relationship(String relationship, String sourceLabel, String targetLabel) {
    }
}
