package com.docindex.common.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted form of the id map: the forward mapping internal id to external key
 * and the next id the allocator will hand out.
 */
public record IdMapSnapshot(long nextId, Map<Long, String> keysById) {

    public IdMapSnapshot {
        if (nextId <= 0) {
            throw new IllegalArgumentException("nextId must be positive");
        }
        keysById = Collections.unmodifiableMap(new LinkedHashMap<>(keysById));
    }

    public static IdMapSnapshot empty() {
        return new IdMapSnapshot(1L, Map.of());
    }
}
