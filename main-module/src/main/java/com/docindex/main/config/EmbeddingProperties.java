package com.docindex.main.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "doc-index.embedding")
public class EmbeddingProperties {

    @NotNull
    private Provider provider = Provider.HASHING;

    /**
     * Output dimension of the hashing model; ONNX models report their own.
     */
    @Min(1)
    private int dimension = 384;

    /**
     * Directory with model.onnx and tokenizer.json.
     */
    private String modelDirectory = "./models/all-MiniLM-L6-v2";

    @Min(1)
    private int maxTokens = 512;

    /**
     * ONNX intra-op threads, 0 picks all cores but one.
     */
    @Min(0)
    private int intraOpThreads = 0;

    public enum Provider {
        HASHING,
        ONNX
    }
}
