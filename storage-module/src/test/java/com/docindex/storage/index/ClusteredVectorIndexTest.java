package com.docindex.storage.index;

import com.docindex.common.exception.IndexNotTrainedException;
import com.docindex.common.exception.InsufficientTrainingDataException;
import com.docindex.storage.similarity.VectorSimilarity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ClusteredVectorIndexTest {

    private final VectorSimilarity vectorSimilarity = new VectorSimilarity();

    private ClusteredVectorIndex newIndex(int clusters, int probes, InsufficientTrainingPolicy policy) {
        return new ClusteredVectorIndex(
            vectorSimilarity,
            new KMeansTrainer(vectorSimilarity, 25, 42L),
            2,
            clusters,
            probes,
            policy
        );
    }

    private static List<float[]> grid(int size) {
        List<float[]> vectors = new ArrayList<>();
        Random random = new Random(7);
        for (int i = 0; i < size; i++) {
            float base = (i % 4) * 10f;
            vectors.add(new float[]{base + random.nextFloat(), base + random.nextFloat()});
        }
        return vectors;
    }

    @Test
    void testAddBeforeTrainingFails() {
        ClusteredVectorIndex index = newIndex(4, 1, InsufficientTrainingPolicy.FAIL);

        assertFalse(index.isTrained());
        assertThrows(IndexNotTrainedException.class, () -> index.add(new float[]{0f, 0f}, 1L));
    }

    @Test
    void testTrainAndSearch() {
        ClusteredVectorIndex index = newIndex(4, 4, InsufficientTrainingPolicy.FAIL);
        List<float[]> vectors = grid(40);
        index.train(vectors);
        for (int i = 0; i < vectors.size(); i++) {
            index.add(vectors.get(i), i + 1L);
        }

        List<Neighbor> result = index.search(vectors.get(5), 3);

        assertTrue(index.isTrained());
        assertEquals(4, index.clusterCount());
        assertEquals(3, result.size());
        assertEquals(6L, result.get(0).id());
        assertEquals(0.0, result.get(0).distance(), 1e-9);
        assertTrue(result.get(1).distance() <= result.get(2).distance());
    }

    @Test
    void testSingleProbeFindsVectorInOwnCluster() {
        ClusteredVectorIndex index = newIndex(4, 1, InsufficientTrainingPolicy.FAIL);
        List<float[]> vectors = grid(40);
        index.train(vectors);
        for (int i = 0; i < vectors.size(); i++) {
            index.add(vectors.get(i), i + 1L);
        }

        assertEquals(12L, index.search(vectors.get(11), 1).get(0).id());
    }

    @Test
    void testInsufficientSampleFailsUnderFailPolicy() {
        ClusteredVectorIndex index = newIndex(100, 1, InsufficientTrainingPolicy.FAIL);

        InsufficientTrainingDataException e = assertThrows(InsufficientTrainingDataException.class,
            () -> index.train(grid(5)));

        assertEquals(5, e.getSampleSize());
        assertEquals(100, e.getRequiredSize());
        assertFalse(index.isTrained());
    }

    @Test
    void testInsufficientSampleDegradesUnderWarnPolicy() {
        ClusteredVectorIndex index = newIndex(100, 1, InsufficientTrainingPolicy.WARN);

        index.train(grid(5));

        IndexState state = index.state();
        assertTrue(state.trained());
        assertTrue(state.degraded());
        assertEquals(5, index.clusterCount());
    }

    @Test
    void testEmptySampleAlwaysFails() {
        ClusteredVectorIndex index = newIndex(4, 1, InsufficientTrainingPolicy.WARN);

        assertThrows(InsufficientTrainingDataException.class, () -> index.train(List.of()));
    }

    @Test
    void testSecondTrainingIsIgnored() {
        ClusteredVectorIndex index = newIndex(4, 1, InsufficientTrainingPolicy.FAIL);
        index.train(grid(40));

        index.train(grid(2));

        assertEquals(4, index.clusterCount());
        assertFalse(index.state().degraded());
    }

    @Test
    void testRemoveAndRestore() {
        ClusteredVectorIndex index = newIndex(4, 4, InsufficientTrainingPolicy.FAIL);
        List<float[]> vectors = grid(20);
        index.train(vectors);
        index.add(vectors.get(0), 1L);
        index.add(vectors.get(1), 2L);

        float[] removed = index.vector(1L).orElseThrow();
        assertTrue(index.remove(1L));
        assertFalse(index.contains(1L));
        assertEquals(1, index.size());

        index.add(removed, 1L);
        assertEquals(1L, index.search(vectors.get(0), 1).get(0).id());
    }
}
