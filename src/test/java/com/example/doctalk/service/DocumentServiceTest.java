package com.example.doctalk.service;

import com.example.doctalk.exception.InvalidRequestException;
import com.example.doctalk.exception.NotFoundException;
import com.example.doctalk.exception.RateLimitExceededException;
import com.example.doctalk.model.DocumentPage;
import com.example.doctalk.model.DocumentSummary;
import com.example.doctalk.model.RateDecision;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.repository.DocumentCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DocumentServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private static final RateDecision ADMITTED = new RateDecision(true, 99, 100, NOW.plusSeconds(1800));

    @Mock
    private DocumentCatalog documentCatalog;
    @Mock
    private RateGate rateGate;

    @InjectMocks
    private DocumentService documentService;

    @Test
    void getSummary_groupsNodesByTypeAndCounts() {
        when(rateGate.require("u1", RateOperation.GRAPH_READ)).thenReturn(ADMITTED);
        when(documentCatalog.findSummary("d1", "u1")).thenReturn(Optional.of(DocumentSummary.of(
                "d1", "lease.pdf", "completed", NOW,
                List.of(new DocumentSummary.Node("n1", "Acme", "ORG"),
                        new DocumentSummary.Node("n2", "Globex", "ORG"),
                        new DocumentSummary.Node("n3", "Jane Doe", "PERSON")),
                List.of(new DocumentSummary.Relationship("SIGNED_BY", "Acme", "Jane Doe")),
                List.of("sample"))));

        DocumentSummary summary = documentService.getSummary("u1", "d1");

        assertThat(summary.stats()).isEqualTo(new DocumentSummary.Stats(3, 1, 2));
        assertThat(summary.nodesByType()).containsOnlyKeys("ORG", "PERSON");
        assertThat(summary.nodesByType().get("ORG")).extracting(DocumentSummary.Node::label)
                .containsExactly("Acme", "Globex");
    }

    @Test
    void getSummary_otherUsersDocument_throwsNotFound() {
        when(rateGate.require("u1", RateOperation.GRAPH_READ)).thenReturn(ADMITTED);
        when(documentCatalog.findSummary("d9", "u1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> documentService.getSummary("u1", "d9"))
                .isInstanceOf(NotFoundException.class)
                .hasMessage("Document not found");
    }

    @Test
    void getSummary_budgetSpent_skipsStore() {
        when(rateGate.require("u1", RateOperation.GRAPH_READ)).thenThrow(new RateLimitExceededException(
                RateOperation.GRAPH_READ, new RateDecision(false, 0, 100, NOW.plusSeconds(60)), NOW));

        assertThatThrownBy(() -> documentService.getSummary("u1", "d1"))
                .isInstanceOf(RateLimitExceededException.class);
        verifyNoInteractions(documentCatalog);
    }

    @Test
    void getDocuments_limitOutOfRange_rejected() {
        assertThatThrownBy(() -> documentService.getDocuments("u1", 1, 51))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> documentService.getDocuments("u1", 0, 5))
                .isInstanceOf(InvalidRequestException.class);
    }

    @Test
    void getDocuments_storeDown_returnsEmptyPage() {
        when(documentCatalog.page("u1", 1, 5)).thenThrow(new DataAccessResourceFailureException("db down"));

        DocumentPage page = documentService.getDocuments("u1", 1, 5);

        assertThat(page.documents()).isEmpty();
        assertThat(page.totalPages()).isEqualTo(1);
    }
}
