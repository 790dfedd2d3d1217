package com.example.doctalk.service;

import com.example.doctalk.config.RetrievalProperties;
import com.example.doctalk.model.Citation;
import com.example.doctalk.model.DocumentRef;
import com.example.doctalk.model.EntitySummary;
import com.example.doctalk.model.EvidenceBundle;
import com.example.doctalk.model.EvidenceChunk;
import com.example.doctalk.model.GraphFact;
import com.example.doctalk.repository.DocumentCatalog;
import com.example.doctalk.repository.GraphStore;
import com.example.doctalk.repository.VectorIndex;
import com.example.doctalk.util.TextUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Gathers the evidence for one question:
 * - vector hits over the user's chunks
 * - graph edges matching the query
 * - the workspace's most connected entities
 * - the user's document list
 * <p>
 * The four lookups run concurrently on bounded elastic workers. Each one is isolated: an error
 * or timeout turns that section into an empty list and a warning, never a failed bundle.
 */
@Service
@RequiredArgsConstructor
public class ContextFusionEngine {

    private static final Logger log = LoggerFactory.getLogger(ContextFusionEngine.class);

    private final EmbeddingModel embeddingModel;
    private final VectorIndex vectorIndex;
    private final GraphStore graphStore;
    private final DocumentCatalog documentCatalog;
    private final RetrievalProperties properties;

    public Mono<EvidenceBundle> fuse(String query, String userId) {
        return fuse(query, userId, properties.getMinScore());
    }

    /**
     * @param minScore similarity threshold for vector hits, overriding the configured default
     */
    public Mono<EvidenceBundle> fuse(String query, String userId, double minScore) {
        Mono<List<EvidenceChunk>> chunks = lookup("vector", userId,
                () -> searchChunks(query, userId, minScore));
        Mono<List<GraphFact>> facts = lookup("graph", userId,
                () -> graphStore.findRelated(query, userId, properties.getRelatedFactsLimit()));
        Mono<List<EntitySummary>> entities = lookup("entities", userId,
                () -> graphStore.topEntities(userId, properties.getTopEntitiesLimit()));
        Mono<List<DocumentRef>> documents = lookup("catalog", userId,
                () -> documentCatalog.list(userId));

        return Mono.zip(chunks, facts, entities, documents)
                .map(t -> {
                    List<EvidenceChunk> ranked = rank(t.getT1(), minScore);
                    return new EvidenceBundle(query, ranked, t.getT2(), t.getT3(), t.getT4(),
                            buildCitations(ranked));
                })
                .doOnNext(bundle -> log.debug(
                        "Evidence for user {}: {} chunks, {} facts, {} entities, {} documents, {} citations",
                        userId, bundle.chunks().size(), bundle.facts().size(), bundle.entities().size(),
                        bundle.documents().size(), bundle.citations().size()));
    }

    private List<EvidenceChunk> searchChunks(String query, String userId, double minScore) {
        float[] vector = embeddingModel.embed(query);
        if (vector == null || vector.length == 0) {
            throw new IllegalStateException("Embedding model returned an empty vector");
        }
        return vectorIndex.search(vector, userId, properties.getTopK(), minScore);
    }

    private <T> Mono<List<T>> lookup(String source, String userId, Callable<List<T>> call) {
        return Mono.fromCallable(call)
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(properties.getSourceTimeout())
                .defaultIfEmpty(List.of())
                .onErrorResume(e -> {
                    log.warn("Evidence source '{}' failed for user {}, continuing without it: {}",
                            source, userId, e.toString());
                    return Mono.just(List.of());
                });
    }

    /**
     * Best first, above the threshold, no repeated (file, text) pairs, at most top-K.
     */
    List<EvidenceChunk> rank(List<EvidenceChunk> chunks, double minScore) {
        List<EvidenceChunk> sorted = new ArrayList<>(chunks);
        sorted.sort(Comparator.comparingDouble(EvidenceChunk::score).reversed());

        Set<String> seen = new HashSet<>();
        List<EvidenceChunk> ranked = new ArrayList<>();
        for (EvidenceChunk chunk : sorted) {
            if (ranked.size() >= properties.getTopK()) {
                break;
            }
            if (chunk.score() <= minScore) {
                continue;
            }
            if (seen.add(chunk.sourceDocument() + "\n" + chunk.text())) {
                ranked.add(chunk);
            }
        }
        return ranked;
    }

    /**
     * One citation per filename. Chunks arrive best first, so the first chunk seen for a file is
     * its highest scoring one.
     */
    List<Citation> buildCitations(List<EvidenceChunk> ranked) {
        Map<String, Citation> byFilename = new LinkedHashMap<>();
        for (EvidenceChunk chunk : ranked) {
            byFilename.computeIfAbsent(chunk.sourceDocument(), filename -> Citation.of(
                    filename,
                    chunk.score(),
                    TextUtils.preview(chunk.text(), properties.getPreviewLength())));
        }
        return List.copyOf(byFilename.values());
    }
}
