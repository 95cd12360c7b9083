package com.docindex.storage.index;

/**
 * Snapshot of a vector index lifecycle.
 *
 * @param variant  structure kind
 * @param trained  whether vectors can be added
 * @param count    number of stored vectors
 * @param degraded trained on fewer samples than configured clusters
 */
public record IndexState(IndexVariant variant, boolean trained, int count, boolean degraded) {
}
