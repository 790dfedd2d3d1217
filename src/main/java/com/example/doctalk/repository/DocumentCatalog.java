package com.example.doctalk.repository;

import com.example.doctalk.model.DocumentPage;
import com.example.doctalk.model.DocumentRef;
import com.example.doctalk.model.DocumentSummary;

import java.util.List;
import java.util.Optional;

/**
 * Metadata of the documents a user has uploaded.
 */
public interface DocumentCatalog {

    /**
     * All of the user's documents, newest first.
     */
    List<DocumentRef> list(String userId);

    /**
     * @param page  1-based page number
     * @param limit page size
     */
    DocumentPage page(String userId, int page, int limit);

    /**
     * Extracted entities, relationships and sample text of one document; empty when the
     * document does not exist or belongs to another user.
     */
    Optional<DocumentSummary> findSummary(String documentId, String userId);
}
