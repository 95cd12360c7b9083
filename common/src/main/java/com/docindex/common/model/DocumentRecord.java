package com.docindex.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Builder;

import java.time.Instant;
import java.util.List;

/**
 * Metadata of a document as kept by the document store.
 * The {@code indexed} flag tells whether the document is currently present in the vector index.
 */
@Builder
public record DocumentRecord(
    @NotBlank
    @JsonProperty("key")
    String key,

    @JsonProperty("title")
    String title,

    @JsonProperty("authors")
    List<String> authors,

    @JsonProperty("abstractText")
    String abstractText,

    @JsonProperty("primaryCategory")
    String primaryCategory,

    @JsonProperty("indexed")
    boolean indexed,

    @JsonProperty("createdAt")
    Instant createdAt,

    @JsonProperty("updatedAt")
    Instant updatedAt
) {
    @JsonCreator
    public DocumentRecord {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document key cannot be null or blank");
        }
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    /**
     * Creates a copy with the indexed flag changed
     */
    public DocumentRecord withIndexed(boolean newIndexed) {
        return new DocumentRecord(key, title, authors, abstractText, primaryCategory, newIndexed,
                createdAt, Instant.now());
    }
}
