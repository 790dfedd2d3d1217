package com.example.doctalk.service;

import com.example.doctalk.config.RetrievalProperties;
import com.example.doctalk.model.Citation;
import com.example.doctalk.model.DocumentRef;
import com.example.doctalk.model.EntitySummary;
import com.example.doctalk.model.EvidenceChunk;
import com.example.doctalk.model.GraphFact;
import com.example.doctalk.repository.DocumentCatalog;
import com.example.doctalk.repository.GraphStore;
import com.example.doctalk.repository.VectorIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextFusionEngineTest {

    @Mock
    private EmbeddingModel embeddingModel;
    @Mock
    private VectorIndex vectorIndex;
    @Mock
    private GraphStore graphStore;
    @Mock
    private DocumentCatalog documentCatalog;

    private RetrievalProperties properties;
    private ContextFusionEngine engine;

    @BeforeEach
    void setUp() {
        properties = new RetrievalProperties();
        engine = new ContextFusionEngine(embeddingModel, vectorIndex, graphStore, documentCatalog, properties);
    }

    @Test
    void fuse_citationsOnePerDistinctFilename_keepingBestPreview() {
        when(embeddingModel.embed("termination")).thenReturn(new float[]{0.1f, 0.2f});
        when(vectorIndex.search(any(), eq("u1"), eq(8), eq(0.1))).thenReturn(List.of(
                new EvidenceChunk("second best from a", "a.pdf", 0.80),
                new EvidenceChunk("best from a", "a.pdf", 0.912),
                new EvidenceChunk("only from b", "b.docx", 0.55)));

        StepVerifier.create(engine.fuse("termination", "u1"))
                .assertNext(bundle -> {
                    assertThat(bundle.chunks()).extracting(EvidenceChunk::score)
                            .containsExactly(0.912, 0.80, 0.55);
                    assertThat(bundle.citations()).hasSize(2);
                    Citation a = bundle.citations().get(0);
                    assertThat(a.filename()).isEqualTo("a.pdf");
                    assertThat(a.similarity()).isEqualTo("91.2");
                    assertThat(a.preview()).isEqualTo("best from a");
                    assertThat(bundle.citations().get(1).filename()).isEqualTo("b.docx");
                })
                .verifyComplete();
    }

    @Test
    void fuse_oneSourceFails_othersStillContribute() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{0.1f});
        when(vectorIndex.search(any(), anyString(), anyInt(), anyDouble()))
                .thenReturn(List.of(new EvidenceChunk("text", "a.pdf", 0.7)));
        when(graphStore.findRelated(anyString(), anyString(), anyInt()))
                .thenThrow(new DataAccessResourceFailureException("graph tables unavailable"));
        when(graphStore.topEntities("u1", 8)).thenReturn(List.of(new EntitySummary("Acme", "ORG", 12)));
        when(documentCatalog.list("u1")).thenReturn(List.of(new DocumentRef("a.pdf", Instant.now())));

        StepVerifier.create(engine.fuse("acme", "u1"))
                .assertNext(bundle -> {
                    assertThat(bundle.facts()).isEmpty();
                    assertThat(bundle.chunks()).hasSize(1);
                    assertThat(bundle.entities()).hasSize(1);
                    assertThat(bundle.documents()).hasSize(1);
                    assertThat(bundle.isEmpty()).isFalse();
                })
                .verifyComplete();
    }

    @Test
    void fuse_embeddingFails_vectorSectionEmpty() {
        when(embeddingModel.embed(anyString())).thenThrow(new RuntimeException("embedding quota exceeded"));
        when(graphStore.findRelated("acme", "u1", 10))
                .thenReturn(List.of(new GraphFact("Acme", "ORG", "SIGNED", "Contract", "DOCUMENT")));

        StepVerifier.create(engine.fuse("acme", "u1"))
                .assertNext(bundle -> {
                    assertThat(bundle.chunks()).isEmpty();
                    assertThat(bundle.citations()).isEmpty();
                    assertThat(bundle.facts()).hasSize(1);
                })
                .verifyComplete();
    }

    @Test
    void fuse_slowSource_timesOutToEmpty() {
        properties.setSourceTimeout(Duration.ofMillis(100));
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{0.1f});
        when(documentCatalog.list("u1")).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of(new DocumentRef("late.pdf", Instant.now()));
        });

        StepVerifier.create(engine.fuse("anything", "u1"))
                .assertNext(bundle -> assertThat(bundle.documents()).isEmpty())
                .verifyComplete();
    }

    @Test
    void fuse_allSourcesEmpty_returnsEmptyBundle() {
        when(embeddingModel.embed(anyString())).thenReturn(new float[]{0.1f});

        StepVerifier.create(engine.fuse("anything", "u1"))
                .assertNext(bundle -> {
                    assertThat(bundle.isEmpty()).isTrue();
                    assertThat(bundle.query()).isEqualTo("anything");
                })
                .verifyComplete();
    }

    @Test
    void rank_dropsBelowThresholdAndDuplicates() {
        List<EvidenceChunk> ranked = engine.rank(List.of(
                new EvidenceChunk("same", "a.pdf", 0.6),
                new EvidenceChunk("same", "a.pdf", 0.5),
                new EvidenceChunk("weak", "b.pdf", 0.1),
                new EvidenceChunk("other", "b.pdf", 0.3)), 0.1);

        assertThat(ranked).extracting(EvidenceChunk::text).containsExactly("same", "other");
    }
}
