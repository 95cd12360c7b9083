package com.docindex.main.controller;

import com.docindex.common.exception.DocumentNotFoundException;
import com.docindex.common.model.DocumentRecord;
import com.docindex.main.dto.RegisterDocumentRequest;
import com.docindex.main.service.DocumentService;
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
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
@Tag(name = "Documents", description = "Registration of documents to be indexed")
public class DocumentController {

    private final DocumentService documentService;

    @PutMapping
    @Operation(summary = "Register a document",
               description = "Create or update a document; new or changed documents are indexed by the next update")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Document stored"),
        @ApiResponse(responseCode = "400", description = "Invalid document")
    })
    public ResponseEntity<DocumentRecord> register(@Valid @RequestBody RegisterDocumentRequest request) {
        log.info("Received register request: key={}", request.getKey());
        return ResponseEntity.ok(documentService.register(request));
    }

    @GetMapping("/{key}")
    @Operation(summary = "Get a document")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Document retrieved"),
        @ApiResponse(responseCode = "404", description = "Document not found")
    })
    public ResponseEntity<DocumentRecord> get(@PathVariable String key) {
        return documentService.get(key)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new DocumentNotFoundException(key));
    }

    @GetMapping
    @Operation(summary = "List documents", description = "List documents in key order")
    public ResponseEntity<List<DocumentRecord>> list(
            @RequestParam(defaultValue = "100") @Min(1) @Max(1000) int limit) {
        return ResponseEntity.ok(documentService.list(limit));
    }

    @PostMapping("/{key}/index")
    @Operation(summary = "Index a document now", description = "Embed and index a stored document immediately")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "true when indexed, false when the text could not be encoded or the index awaits training"),
        @ApiResponse(responseCode = "404", description = "Document not found or has no text")
    })
    public ResponseEntity<Boolean> index(@PathVariable String key) {
        log.info("Received index request: key={}", key);
        return ResponseEntity.ok(documentService.indexNow(key));
    }

    @DeleteMapping("/{key}")
    @Operation(summary = "Delete a document", description = "Remove a document from the index and the store")
    public ResponseEntity<Boolean> delete(@PathVariable String key) {
        log.info("Received delete request: key={}", key);
        return ResponseEntity.ok(documentService.delete(key));
    }
}
