package com.docindex.storage.index;

/**
 * What a clustered index does when asked to train on fewer vectors than it has clusters.
 */
public enum InsufficientTrainingPolicy {
    /** Reject the sample with InsufficientTrainingDataException */
    FAIL,
    /** Train with one cluster per sample, log a warning and flag the index as degraded */
    WARN
}
