package com.docindex.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * A search hit: external key of the document and its L2 distance to the query (smaller is closer).
 */
public record SimilarDocument(
    @NotNull
    @JsonProperty("key")
    String key,

    @JsonProperty("distance")
    double distance
) {
    @JsonCreator
    public SimilarDocument {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        if (distance < 0 || Double.isNaN(distance)) {
            throw new IllegalArgumentException("Distance cannot be negative");
        }
    }
}
