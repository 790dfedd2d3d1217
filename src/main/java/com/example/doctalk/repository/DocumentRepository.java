package com.example.doctalk.repository;

import com.example.doctalk.model.DocumentPage;
import com.example.doctalk.model.DocumentRef;
import com.example.doctalk.model.DocumentSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class DocumentRepository implements DocumentCatalog {

    private static final int SAMPLE_CONTENT_LIMIT = 5;

    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<DocumentRef> list(String userId) {
        return jdbcTemplate.query("""
                SELECT filename, created_at
                FROM documents
                WHERE user_id = ?
                ORDER BY created_at DESC
                """, (rs, rowNum) -> new DocumentRef(
                rs.getString("filename"),
                toInstant(rs.getTimestamp("created_at"))
        ), userId);
    }

    @Override
    public DocumentPage page(String userId, int page, int limit) {
        Long total = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM documents WHERE user_id = ?", Long.class, userId);
        long totalDocs = total == null ? 0L : total;
        int totalPages = (int) Math.max(1, (totalDocs + limit - 1) / limit);

        int offset = (page - 1) * limit;
        List<DocumentPage.Entry> entries = jdbcTemplate.query("""
                SELECT id, filename, status, created_at
                FROM documents
                WHERE user_id = ?
                ORDER BY created_at DESC
                LIMIT ? OFFSET ?
                """, (rs, rowNum) -> new DocumentPage.Entry(
                rs.getString("id"),
                rs.getString("filename"),
                rs.getString("status"),
                toInstant(rs.getTimestamp("created_at"))
        ), userId, limit, offset);

        return new DocumentPage(entries, totalPages);
    }

    @Override
    public Optional<DocumentSummary> findSummary(String documentId, String userId) {
        UUID id;
        try {
            id = UUID.fromString(documentId);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }

        List<DocumentPage.Entry> docs = jdbcTemplate.query("""
                SELECT id, filename, status, created_at
                FROM documents
                WHERE id = ? AND user_id = ?
                """, (rs, rowNum) -> new DocumentPage.Entry(
                rs.getString("id"),
                rs.getString("filename"),
                rs.getString("status"),
                toInstant(rs.getTimestamp("created_at"))
        ), id, userId);

        if (docs.isEmpty()) {
            return Optional.empty();
        }
        DocumentPage.Entry doc = docs.get(0);

        List<DocumentSummary.Node> nodes = jdbcTemplate.query("""
                SELECT id, label, type
                FROM nodes
                WHERE document_id = ?
                ORDER BY type, label
                """, (rs, rowNum) -> new DocumentSummary.Node(
                rs.getString("id"),
                rs.getString("label"),
                rs.getString("type") == null ? "ENTITY" : rs.getString("type")
        ), id);

        List<DocumentSummary.Relationship> relationships = jdbcTemplate.query("""
                SELECT e.relationship, n1.label AS source_label, n2.label AS target_label
                FROM edges e
                JOIN nodes n1 ON e.source_node_id = n1.id
                JOIN nodes n2 ON e.target_node_id = n2.id
                WHERE e.document_id = ?
                ORDER BY e.relationship
                """, (rs, rowNum) -> new DocumentSummary.Relationship(
                rs.getString("relationship"),
                rs.getString("source_label"),
                rs.getString("target_label")
        ), id);

        List<String> samples = jdbcTemplate.queryForList("""
                SELECT content
                FROM embeddings
                WHERE document_id = ?
                LIMIT ?
                """, String.class, id, SAMPLE_CONTENT_LIMIT);

        return Optional.of(DocumentSummary.of(doc.id(), doc.filename(), doc.status(), doc.uploadedAt(),
                nodes, relationships, samples));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
