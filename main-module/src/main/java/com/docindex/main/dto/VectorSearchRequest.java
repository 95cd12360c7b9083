package com.docindex.main.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Request for searching documents by a raw embedding vector")
public class VectorSearchRequest {

    @NotNull
    @Schema(description = "Query vector, must match the embedding dimension", example = "[0.1, 0.2, 0.3]")
    private float[] vector;

    @Min(1)
    @Max(50)
    @Schema(description = "Number of documents to return", example = "10")
    private int k = 10;
}
