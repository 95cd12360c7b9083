package com.docindex.main.controller;

import com.docindex.common.model.SimilarDocument;
import com.docindex.main.dto.SimilarDocumentsResponse;
import com.docindex.main.dto.VectorSearchRequest;
import com.docindex.main.service.SearchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Tag(name = "Search", description = "Similarity search over indexed documents")
public class SearchController {

    private final SearchService searchService;

    @GetMapping("/similar/{key}")
    @Operation(summary = "Find similar documents",
               description = "Find the K documents closest to a stored document; the document itself is excluded")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Similar documents retrieved"),
        @ApiResponse(responseCode = "404", description = "Document not found or has no text"),
        @ApiResponse(responseCode = "500", description = "Internal server error during search")
    })
    public ResponseEntity<SimilarDocumentsResponse> similar(
            @PathVariable String key,
            @RequestParam(defaultValue = "10") @Min(1) @Max(50) int k) {
        log.info("Received similar request: key={}, k={}", key, k);
        return ResponseEntity.ok(searchService.similarToDocument(key, k));
    }

    @GetMapping("/semantic")
    @Operation(summary = "Semantic search", description = "Find the K documents closest to a free-text query")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Matching documents retrieved"),
        @ApiResponse(responseCode = "400", description = "Blank query"),
        @ApiResponse(responseCode = "500", description = "Internal server error during search")
    })
    public ResponseEntity<SimilarDocumentsResponse> semantic(
            @RequestParam String q,
            @RequestParam(defaultValue = "10") @Min(1) @Max(50) int k) {
        log.info("Received semantic search request: q='{}', k={}", q, k);
        return ResponseEntity.ok(searchService.semanticSearch(q, k));
    }

    @PostMapping("/vector")
    @Operation(summary = "Search by vector", description = "Find the K documents closest to a raw embedding vector")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Nearest documents retrieved"),
        @ApiResponse(responseCode = "400", description = "Vector dimension does not match the index"),
        @ApiResponse(responseCode = "500", description = "Internal server error during search")
    })
    public ResponseEntity<List<SimilarDocument>> byVector(@Valid @RequestBody VectorSearchRequest request) {
        log.info("Received vector search request: vector length={}, k={}",
                request.getVector() != null ? request.getVector().length : 0, request.getK());
        return ResponseEntity.ok(searchService.searchByVector(request.getVector(), request.getK()));
    }
}
