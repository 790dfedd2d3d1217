package com.example.doctalk.model;

import java.util.List;

/**
 * Fused retrieval result for one question. Built once per request and never mutated.
 *
 * @param query     the (possibly rewritten) search query the bundle was built for
 * @param chunks    vector hits, best first
 * @param facts     graph edges whose endpoints match the query
 * @param entities  most connected entities of the workspace
 * @param documents the user's documents, newest first
 * @param citations one per distinct chunk filename
 */
public record EvidenceBundle(
        String query,
        List<EvidenceChunk> chunks,
        List<GraphFact> facts,
        List<EntitySummary> entities,
        List<DocumentRef> documents,
        List<Citation> citations
) {
    public EvidenceBundle {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
        facts = facts == null ? List.of() : List.copyOf(facts);
        entities = entities == null ? List.of() : List.copyOf(entities);
        documents = documents == null ? List.of() : List.copyOf(documents);
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static EvidenceBundle empty(String query) {
        return new EvidenceBundle(query, List.of(), List.of(), List.of(), List.of(), List.of());
    }

    /**
     * True when no source contributed anything; the answer is then the canned fallback.
     */
    public boolean isEmpty() {
        return chunks.isEmpty() && facts.isEmpty() && entities.isEmpty() && documents.isEmpty();
    }
}
