package com.example.doctalk.controller;

import com.example.doctalk.model.DocumentPage;
import com.example.doctalk.model.DocumentSummary;
import com.example.doctalk.service.DocumentService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "documents")
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final DocumentService documentService;

    @GetMapping
    public DocumentPage list(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "5") int limit) {
        return documentService.getDocuments(CurrentUser.require(userHeader), page, limit);
    }

    @GetMapping("/{documentId}/summary")
    public DocumentSummary summary(
            @RequestHeader(value = CurrentUser.HEADER, required = false) String userHeader,
            @PathVariable String documentId) {
        return documentService.getSummary(CurrentUser.require(userHeader), documentId);
    }
}
