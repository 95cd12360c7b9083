package com.docindex.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Search result ordered by ascending distance")
public record SimilarDocumentsResponse(
        @Schema(description = "Query key or query text")
        String query,
        int total,
        List<SimilarDocumentView> documents) {

    public static SimilarDocumentsResponse of(String query, List<SimilarDocumentView> documents) {
        return new SimilarDocumentsResponse(query, documents.size(), documents);
    }
}
