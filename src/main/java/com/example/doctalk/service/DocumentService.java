package com.example.doctalk.service;

import com.example.doctalk.exception.InvalidRequestException;
import com.example.doctalk.exception.NotFoundException;
import com.example.doctalk.model.DocumentPage;
import com.example.doctalk.model.DocumentSummary;
import com.example.doctalk.model.RateOperation;
import com.example.doctalk.repository.DocumentCatalog;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class DocumentService {

    private static final Logger log = LoggerFactory.getLogger(DocumentService.class);

    static final int MAX_PAGE_SIZE = 50;

    private final DocumentCatalog documentCatalog;
    private final RateGate rateGate;

    public DocumentPage getDocuments(String userId, int page, int limit) {
        if (page < 1) {
            throw new InvalidRequestException("page must be at least 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        try {
            return documentCatalog.page(userId, page, limit);
        } catch (DataAccessException e) {
            log.error("Failed to fetch documents for user {}", userId, e);
            return new DocumentPage(List.of(), 1);
        }
    }

    /**
     * Counted against the graph-read budget, like the other graph views.
     */
    public DocumentSummary getSummary(String userId, String documentId) {
        rateGate.require(userId, RateOperation.GRAPH_READ);
        DocumentSummary summary = documentCatalog.findSummary(documentId, userId)
                .orElseThrow(() -> new NotFoundException("Document not found"));
        log.debug("Summary for document {}: {} nodes, {} edges",
                documentId, summary.stats().totalNodes(), summary.stats().totalEdges());
        return summary;
    }
}
