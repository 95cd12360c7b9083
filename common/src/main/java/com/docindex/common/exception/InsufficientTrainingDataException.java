package com.docindex.common.exception;

import lombok.Getter;

/**
 * The training sample is smaller than the number of clusters the index is configured with.
 */
@Getter
public class InsufficientTrainingDataException extends DocIndexException {

    private final int sampleSize;
    private final int requiredSize;

    public InsufficientTrainingDataException(int sampleSize, int requiredSize) {
        super(String.format("Training sample of %d vectors is smaller than the %d clusters required",
                sampleSize, requiredSize));
        this.sampleSize = sampleSize;
        this.requiredSize = requiredSize;
    }
}
