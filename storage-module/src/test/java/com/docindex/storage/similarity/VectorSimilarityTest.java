package com.docindex.storage.similarity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorSimilarityTest {

    private final VectorSimilarity vectorSimilarity = new VectorSimilarity();

    @Test
    void euclideanDistance() {
        assertEquals(5.0, vectorSimilarity.euclideanDistance(new float[]{0f, 0f}, new float[]{3f, 4f}), 1e-9);
        assertEquals(25.0, vectorSimilarity.squaredEuclideanDistance(new float[]{0f, 0f}, new float[]{3f, 4f}), 1e-9);
    }

    @Test
    void nearestCentroid() {
        float[][] centroids = {{0f, 0f}, {10f, 10f}, {-5f, 0f}};

        assertEquals(1, vectorSimilarity.nearest(new float[]{8f, 9f}, centroids));
        assertEquals(2, vectorSimilarity.nearest(new float[]{-4f, 1f}, centroids));
    }

    @Test
    void dimensionMismatch() {
        assertThrows(IllegalArgumentException.class,
            () -> vectorSimilarity.euclideanDistance(new float[]{1f}, new float[]{1f, 2f}));
    }
}
