package com.docindex.storage.index;

import java.util.Comparator;

/**
 * Search hit of a {@link VectorIndex}: internal id and L2 distance to the query.
 */
public record Neighbor(long id, double distance) {

    /** Ascending distance, equal distances ordered by ascending id */
    public static final Comparator<Neighbor> BY_DISTANCE = Comparator
            .comparingDouble(Neighbor::distance)
            .thenComparingLong(Neighbor::id);
}
