package com.example.doctalk.repository;

import com.example.doctalk.model.EntitySummary;
import com.example.doctalk.model.GraphFact;
import com.example.doctalk.model.GraphView;
import com.example.doctalk.model.NodeDetails;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the entity-relationship graph extracted from a user's documents.
 */
public interface GraphStore {

    /**
     * Edges where either endpoint label matches {@code term}, case-insensitively.
     */
    List<GraphFact> findRelated(String term, String userId, int k);

    /**
     * Entities ranked by how many edges touch them across the whole workspace.
     */
    List<EntitySummary> topEntities(String userId, int k);

    GraphView loadGraph(String userId);

    Optional<NodeDetails> findNode(String nodeId, String userId);
}
