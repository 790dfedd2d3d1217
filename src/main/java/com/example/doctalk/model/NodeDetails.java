package com.example.doctalk.model;

import java.util.List;

/**
 * One graph node with its neighbourhood and a few text snippets that mention it.
 */
public record NodeDetails(
        String id,
        String label,
        String type,
        String document,
        List<Connection> outgoing,
        List<Connection> incoming,
        List<String> relatedContent
) {
    /**
     * @param nodeId id of the node on the other end of the edge
     */
    public record Connection(String relationship, String nodeId, String label, String type) {
    }
}
