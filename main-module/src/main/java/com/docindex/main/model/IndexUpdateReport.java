package com.docindex.main.model;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Outcome of one index update batch.
 *
 * @param requested documents handed to the update
 * @param added documents successfully indexed
 * @param failed documents skipped because of per-document errors
 * @param trainingDegraded the clustered index was trained on fewer samples than clusters
 */
@Schema(description = "Outcome of an index update batch")
public record IndexUpdateReport(int requested, int added, int failed, boolean trainingDegraded) {

    public static IndexUpdateReport empty() {
        return new IndexUpdateReport(0, 0, 0, false);
    }
}
