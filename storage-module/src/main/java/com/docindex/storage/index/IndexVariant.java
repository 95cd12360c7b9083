package com.docindex.storage.index;

/**
 * Kind of similarity-search structure behind a {@link VectorIndex}.
 */
public enum IndexVariant {
    /** Brute-force linear scan, always trained */
    EXACT((byte) 1),
    /** IVF-flat: k-means partitioned inverted lists, needs one training pass */
    CLUSTERED((byte) 2),
    /** HNSW graph, always trained */
    GRAPH((byte) 3);

    private final byte tag;

    IndexVariant(byte tag) {
        this.tag = tag;
    }

    public byte tag() {
        return tag;
    }

    public static IndexVariant fromTag(byte tag) {
        for (IndexVariant variant : values()) {
            if (variant.tag == tag) {
                return variant;
            }
        }
        throw new IllegalArgumentException("Unknown index variant tag: " + tag);
    }
}
