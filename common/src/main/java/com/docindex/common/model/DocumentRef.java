package com.docindex.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * A document handed to the indexer: its stable external key and the text to embed.
 */
public record DocumentRef(
    @NotBlank
    @JsonProperty("key")
    String key,

    @JsonProperty("text")
    String text
) {
    @JsonCreator
    public DocumentRef {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document key cannot be null or blank");
        }
    }
}
