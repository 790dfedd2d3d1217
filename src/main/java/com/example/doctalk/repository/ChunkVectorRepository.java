package com.example.doctalk.repository;

import com.example.doctalk.model.EvidenceChunk;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
@RequiredArgsConstructor
public class ChunkVectorRepository implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(ChunkVectorRepository.class);

    private static final String UNKNOWN_SOURCE = "Unknown";

    private final JdbcTemplate jdbcTemplate;

    /**
     * Uses the pgvector cosine distance operator {@code <=>}; score = 1 - distance.
     */
    @Override
    public List<EvidenceChunk> search(float[] queryVector, String userId, int k, double minScore) {
        PGvector vector = new PGvector(queryVector);

        String sql = """
                SELECT e.content,
                       d.filename,
                       1 - (e.embedding <=> ?) AS score
                FROM embeddings e
                JOIN documents d ON e.document_id = d.id
                WHERE d.user_id = ?
                  AND 1 - (e.embedding <=> ?) > ?
                ORDER BY e.embedding <=> ?
                LIMIT ?
                """;

        List<EvidenceChunk> rows = jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, vector);
            ps.setString(2, userId);
            ps.setObject(3, vector);
            ps.setDouble(4, minScore);
            ps.setObject(5, vector);
            ps.setInt(6, k);
        }, new EvidenceChunkRowMapper());

        List<EvidenceChunk> valid = rows.stream()
                .filter(c -> c.text() != null && !c.text().isBlank())
                .toList();
        if (valid.size() < rows.size()) {
            log.debug("Dropped {} chunk rows without content for user {}", rows.size() - valid.size(), userId);
        }
        return valid;
    }

    private static class EvidenceChunkRowMapper implements RowMapper<EvidenceChunk> {
        @Override
        public EvidenceChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            String filename = rs.getString("filename");
            double score = rs.getDouble("score");
            return new EvidenceChunk(
                    rs.getString("content"),
                    filename == null || filename.isBlank() ? UNKNOWN_SOURCE : filename,
                    Math.max(0.0, Math.min(1.0, score))
            );
        }
    }
}
