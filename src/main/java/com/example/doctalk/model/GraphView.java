package com.example.doctalk.model;

import java.util.List;

/**
 * Whole-workspace graph in the shape the force-graph UI expects.
 */
public record GraphView(
        List<Node> nodes,
        List<Link> links
) {
    public static GraphView empty() {
        return new GraphView(List.of(), List.of());
    }

    /**
     * @param group entity type, used by the UI for coloring
     */
    public record Node(String id, String name, String group) {
    }

    public record Link(String source, String target, String label) {
    }
}
