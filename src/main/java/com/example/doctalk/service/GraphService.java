package com.example.doctalk.service;

import com.example.doctalk.exception.NotFoundException;
import com.example.doctalk.model.GraphView;
import com.example.doctalk.model.NodeDetails;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.repository.GraphStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Graph reads for the visualization, metered by the graph-read budget.
 */
@Service
@RequiredArgsConstructor
public class GraphService {

    private static final Logger log = LoggerFactory.getLogger(GraphService.class);

    private final RateGate rateGate;
    private final GraphStore graphStore;

    public GraphView getGraph(String userId) {
        rateGate.require(userId, RateOperation.GRAPH_READ);
        try {
            GraphView graph = graphStore.loadGraph(userId);
            log.debug("Graph for user {}: {} nodes, {} edges", userId, graph.nodes().size(), graph.links().size());
            return graph;
        } catch (DataAccessException e) {
            log.error("Graph fetch failed for user {}", userId, e);
            return GraphView.empty();
        }
    }

    public NodeDetails getNode(String userId, String nodeId) {
        rateGate.require(userId, RateOperation.GRAPH_READ);
        NodeDetails details = graphStore.findNode(nodeId, userId)
                .orElseThrow(() -> new NotFoundException("Node not found"));
        log.debug("Node details for {}: {} outgoing, {} incoming connections",
                details.label(), details.outgoing().size(), details.incoming().size());
        return details;
    }
}
