package com.docindex.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "A search hit joined with the document metadata")
public record SimilarDocumentView(
        String key,
        String title,
        List<String> authors,
        String primaryCategory,
        @Schema(description = "L2 distance to the query, smaller is closer")
        double distance) {
}
