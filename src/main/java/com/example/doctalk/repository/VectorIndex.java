package com.example.doctalk.repository;

import com.example.doctalk.model.EvidenceChunk;

import java.util.List;

/**
 * User-scoped similarity search over embedded document chunks.
 */
public interface VectorIndex {

    /**
     * @param queryVector embedding of the search query
     * @param userId      owner whose documents are searched
     * @param k           max hits
     * @param minScore    hits must score strictly above this cosine similarity
     * @return hits ordered by descending score
     */
    List<EvidenceChunk> search(float[] queryVector, String userId, int k, double minScore);
}
