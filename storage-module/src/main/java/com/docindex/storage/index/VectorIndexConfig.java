package com.docindex.storage.index;

import lombok.Builder;

/** Параметры построения векторного индекса */
@Builder(toBuilder = true)
public record VectorIndexConfig(
        IndexVariant variant,
        int dimension,
        int clusters,
        int probes,
        int trainingIterations,
        long seed,
        InsufficientTrainingPolicy insufficientTrainingPolicy,
        int m,
        int ef,
        int efConstruction,
        int initialCapacity) {

    public VectorIndexConfig {
        if (variant == null) {
            throw new IllegalArgumentException("Index variant must be set");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (insufficientTrainingPolicy == null) {
            insufficientTrainingPolicy = InsufficientTrainingPolicy.WARN;
        }
    }
}
