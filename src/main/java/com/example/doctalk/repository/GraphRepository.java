package com.example.doctalk.repository;

import com.example.doctalk.model.EntitySummary;
import com.example.doctalk.model.GraphFact;
import com.example.doctalk.model.GraphView;
import com.example.doctalk.model.NodeDetails;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Graph queries over the {@code nodes} and {@code edges} tables written by the ingestion service.
 */
@Repository
@RequiredArgsConstructor
public class GraphRepository implements GraphStore {

    /** Labels shorter than this are not matched "inside" a query, they hit too many words. */
    private static final int MIN_EMBEDDED_LABEL_LENGTH = 3;

    private static final int RELATED_CONTENT_LIMIT = 3;

    private static final String DEFAULT_TYPE = "ENTITY";

    private static final RowMapper<GraphFact> FACT_MAPPER = (rs, rowNum) -> new GraphFact(
            rs.getString("source"),
            typeOrDefault(rs.getString("source_type")),
            rs.getString("relationship"),
            rs.getString("target"),
            typeOrDefault(rs.getString("target_type"))
    );

    private static final RowMapper<NodeDetails.Connection> CONNECTION_MAPPER = (rs, rowNum) ->
            new NodeDetails.Connection(
                    rs.getString("relationship"),
                    rs.getString("node_id"),
                    rs.getString("label"),
                    typeOrDefault(rs.getString("type"))
            );

    private final JdbcTemplate jdbcTemplate;

    /**
     * Matches edges where an endpoint label contains the term, or where the term (usually a
     * whole question) contains an endpoint label.
     */
    @Override
    public List<GraphFact> findRelated(String term, String userId, int k) {
        if (term == null || term.isBlank()) {
            return List.of();
        }
        String pattern = "%" + escapeLike(term.trim()) + "%";

        String sql = """
                SELECT n.label AS source,
                       n.type AS source_type,
                       e.relationship,
                       n2.label AS target,
                       n2.type AS target_type
                FROM nodes n
                JOIN edges e ON e.source_node_id = n.id
                JOIN nodes n2 ON e.target_node_id = n2.id
                JOIN documents d ON n.document_id = d.id
                WHERE d.user_id = ?
                  AND (
                        n.label ILIKE ?
                     OR n2.label ILIKE ?
                     OR (length(n.label) >= ? AND ? ILIKE '%' || n.label || '%')
                     OR (length(n2.label) >= ? AND ? ILIKE '%' || n2.label || '%')
                  )
                LIMIT ?
                """;

        List<GraphFact> facts = jdbcTemplate.query(sql, FACT_MAPPER,
                userId, pattern, pattern,
                MIN_EMBEDDED_LABEL_LENGTH, term, MIN_EMBEDDED_LABEL_LENGTH, term,
                k);
        return facts.stream()
                .filter(f -> f.subject() != null && f.object() != null && f.relationship() != null)
                .toList();
    }

    @Override
    public List<EntitySummary> topEntities(String userId, int k) {
        String sql = """
                SELECT n.label, n.type, COUNT(e.id) AS connection_count
                FROM nodes n
                JOIN documents d ON n.document_id = d.id
                LEFT JOIN edges e ON e.source_node_id = n.id OR e.target_node_id = n.id
                WHERE d.user_id = ?
                GROUP BY n.label, n.type
                ORDER BY connection_count DESC
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, (rs, rowNum) -> new EntitySummary(
                rs.getString("label"),
                typeOrDefault(rs.getString("type")),
                rs.getLong("connection_count")
        ), userId, k);
    }

    @Override
    public GraphView loadGraph(String userId) {
        List<GraphView.Node> nodes = jdbcTemplate.query("""
                SELECT DISTINCT n.id, n.label, n.type
                FROM nodes n
                JOIN documents d ON n.document_id = d.id
                WHERE d.user_id = ?
                """, (rs, rowNum) -> new GraphView.Node(
                rs.getString("id"),
                rs.getString("label"),
                typeOrDefault(rs.getString("type"))
        ), userId);

        List<GraphView.Link> links = jdbcTemplate.query("""
                SELECT DISTINCT e.source_node_id AS source, e.target_node_id AS target, e.relationship AS label
                FROM edges e
                JOIN documents d ON e.document_id = d.id
                WHERE d.user_id = ?
                """, (rs, rowNum) -> new GraphView.Link(
                rs.getString("source"),
                rs.getString("target"),
                rs.getString("label")
        ), userId);

        return new GraphView(nodes, links);
    }

    @Override
    public Optional<NodeDetails> findNode(String nodeId, String userId) {
        UUID id;
        try {
            id = UUID.fromString(nodeId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        List<NodeRow> found = jdbcTemplate.query("""
                SELECT n.id, n.label, n.type, d.filename, d.id AS document_id
                FROM nodes n
                JOIN documents d ON n.document_id = d.id
                WHERE n.id = ? AND d.user_id = ?
                """, (rs, rowNum) -> new NodeRow(
                rs.getString("id"),
                rs.getString("label"),
                typeOrDefault(rs.getString("type")),
                rs.getString("filename"),
                rs.getObject("document_id", UUID.class)
        ), id, userId);

        if (found.isEmpty()) {
            return Optional.empty();
        }
        NodeRow node = found.get(0);

        List<NodeDetails.Connection> outgoing = jdbcTemplate.query("""
                SELECT e.relationship, n.id AS node_id, n.label, n.type
                FROM edges e
                JOIN nodes n ON e.target_node_id = n.id
                JOIN documents d ON e.document_id = d.id
                WHERE e.source_node_id = ? AND d.user_id = ?
                ORDER BY e.relationship, n.label
                """, CONNECTION_MAPPER, id, userId);

        List<NodeDetails.Connection> incoming = jdbcTemplate.query("""
                SELECT e.relationship, n.id AS node_id, n.label, n.type
                FROM edges e
                JOIN nodes n ON e.source_node_id = n.id
                JOIN documents d ON e.document_id = d.id
                WHERE e.target_node_id = ? AND d.user_id = ?
                ORDER BY e.relationship, n.label
                """, CONNECTION_MAPPER, id, userId);

        List<String> related = jdbcTemplate.queryForList("""
                SELECT DISTINCT e.content
                FROM embeddings e
                WHERE e.document_id = ?
                  AND e.content ILIKE ?
                LIMIT ?
                """, String.class, node.documentId(), "%" + escapeLike(node.label()) + "%", RELATED_CONTENT_LIMIT);

        return Optional.of(new NodeDetails(
                node.id(), node.label(), node.type(), node.filename(),
                outgoing, incoming, related));
    }

    static String escapeLike(String value) {
        return value.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
    }

    private static String typeOrDefault(String type) {
        return type == null || type.isBlank() ? DEFAULT_TYPE : type;
    }

    private record NodeRow(String id, String label, String type, String filename, UUID documentId) {
    }
}
