package com.example.doctalk.model;

/**
 * A text chunk returned by vector search.
 *
 * @param text           chunk content
 * @param sourceDocument filename of the document the chunk came from
 * @param score          cosine similarity, 1 - cosine distance, in [0, 1]
 */
public record EvidenceChunk(
        String text,
        String sourceDocument,
        double score
) {
}
