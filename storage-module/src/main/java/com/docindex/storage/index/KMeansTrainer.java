package com.docindex.storage.index;

import com.docindex.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Кластеризация k-means (засев k-means++, итерации Ллойда) для обучения IVF индекса.
 * Детерминирована при фиксированном seed.
 */
@Slf4j
public class KMeansTrainer {

    private final VectorSimilarity vectorSimilarity;
    private final int maxIterations;
    private final long seed;

    public KMeansTrainer(VectorSimilarity vectorSimilarity, int maxIterations, long seed) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        this.vectorSimilarity = vectorSimilarity;
        this.maxIterations = maxIterations;
        this.seed = seed;
    }

    /**
     * Найти k центроидов для выборки
     * @param sample непустая выборка одинаковой размерности
     * @param k число кластеров, не больше размера выборки
     */
    public float[][] train(List<float[]> sample, int k) {
        if (k <= 0 || k > sample.size()) {
            throw new IllegalArgumentException(
                String.format("Cluster count %d must be in [1, %d]", k, sample.size()));
        }
        int dimension = sample.get(0).length;
        Random random = new Random(seed);

        float[][] centroids = seedCentroids(sample, k, random);
        int[] assignment = new int[sample.size()];
        Arrays.fill(assignment, -1);

        int iteration = 0;
        boolean changed = true;
        while (changed && iteration < maxIterations) {
            changed = false;
            for (int i = 0; i < sample.size(); i++) {
                int nearest = vectorSimilarity.nearest(sample.get(i), centroids);
                if (assignment[i] != nearest) {
                    assignment[i] = nearest;
                    changed = true;
                }
            }
            recomputeCentroids(sample, assignment, centroids, dimension);
            iteration++;
        }

        log.debug("k-means finished after {} iterations, k={}, sample={}, converged={}",
                iteration, k, sample.size(), !changed);
        return centroids;
    }

    private float[][] seedCentroids(List<float[]> sample, int k, Random random) {
        float[][] centroids = new float[k][];
        centroids[0] = sample.get(random.nextInt(sample.size())).clone();

        double[] minDistances = new double[sample.size()];
        Arrays.fill(minDistances, Double.POSITIVE_INFINITY);

        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < sample.size(); i++) {
                double distance = vectorSimilarity.squaredEuclideanDistance(sample.get(i), centroids[c - 1]);
                minDistances[i] = Math.min(minDistances[i], distance);
                total += minDistances[i];
            }

            int chosen;
            if (total == 0.0) {
                // все точки совпадают с уже выбранными центрами
                chosen = random.nextInt(sample.size());
            } else {
                double target = random.nextDouble() * total;
                chosen = sample.size() - 1;
                double cumulative = 0.0;
                for (int i = 0; i < sample.size(); i++) {
                    cumulative += minDistances[i];
                    if (minDistances[i] > 0 && cumulative >= target) {
                        chosen = i;
                        break;
                    }
                }
            }
            centroids[c] = sample.get(chosen).clone();
        }
        return centroids;
    }

    private void recomputeCentroids(List<float[]> sample, int[] assignment, float[][] centroids, int dimension) {
        int k = centroids.length;
        double[][] sums = new double[k][dimension];
        int[] counts = new int[k];

        for (int i = 0; i < sample.size(); i++) {
            int cluster = assignment[i];
            float[] vector = sample.get(i);
            for (int d = 0; d < dimension; d++) {
                sums[cluster][d] += vector[d];
            }
            counts[cluster]++;
        }

        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                // пустой кластер сохраняет прежний центр
                continue;
            }
            for (int d = 0; d < dimension; d++) {
                centroids[c][d] = (float) (sums[c][d] / counts[c]);
            }
        }
    }
}
