package com.docindex.main.model;

import com.docindex.storage.index.IndexVariant;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Current state of the vector index")
public record IndexStats(
        IndexVariant variant,
        boolean trained,
        boolean degraded,
        int count,
        long nextId,
        int dimension,
        boolean dirty) {
}
