package com.docindex.main.controller;

import com.docindex.main.config.IndexProperties;
import com.docindex.main.model.IndexStats;
import com.docindex.main.model.IndexUpdateReport;
import com.docindex.main.service.IndexManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Set;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/index")
@RequiredArgsConstructor
@Tag(name = "Index Administration", description = "Index updates, persistence and statistics")
public class IndexAdminController {

    private final IndexManager indexManager;
    private final IndexProperties indexProperties;

    @PostMapping("/update")
    @Operation(summary = "Index pending documents",
               description = "Index up to batchSize documents the store marks as unindexed, training the index first if needed")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Update finished, see the report for per-document failures"),
        @ApiResponse(responseCode = "500", description = "Training or checkpoint failed")
    })
    public ResponseEntity<IndexUpdateReport> update(@RequestParam(required = false) @Min(1) Integer batchSize) {
        int size = batchSize != null ? batchSize : indexProperties.getBatchSize();
        log.info("Received index update request: batchSize={}", size);
        return ResponseEntity.ok(indexManager.updateIndex(size));
    }

    @PostMapping("/save")
    @Operation(summary = "Save index", description = "Write the index snapshot to disk")
    public ResponseEntity<IndexStats> save() {
        log.info("Received index save request");
        indexManager.save();
        return ResponseEntity.ok(indexManager.stats());
    }

    @GetMapping("/stats")
    @Operation(summary = "Index statistics")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(indexManager.stats());
    }

    @GetMapping("/keys")
    @Operation(summary = "Indexed document keys")
    public ResponseEntity<Set<String>> keys() {
        return ResponseEntity.ok(indexManager.indexedKeys());
    }
}
