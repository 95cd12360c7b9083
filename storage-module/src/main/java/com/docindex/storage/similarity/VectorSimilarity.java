package com.docindex.storage.similarity;

import org.springframework.stereotype.Component;

/** Метрики расстояния между векторами, используемые индексами */
@Component
public class VectorSimilarity {

    /** Вычислить евклидово (L2) расстояние между векторами */
    public double euclideanDistance(float[] vector1, float[] vector2) {
        return Math.sqrt(squaredEuclideanDistance(vector1, vector2));
    }

    /** Квадрат L2 расстояния: дешевле для сравнения, монотонен относительно L2 */
    public double squaredEuclideanDistance(float[] vector1, float[] vector2) {
        if (vector1.length != vector2.length) {
            throw new IllegalArgumentException("Vectors must have the same dimension");
        }

        double sum = 0.0;
        for (int i = 0; i < vector1.length; i++) {
            double diff = (double) vector1[i] - vector2[i];
            sum += diff * diff;
        }
        return sum;
    }

    /** Индекс ближайшего центроида (по L2) */
    public int nearest(float[] vector, float[][] centroids) {
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double distance = squaredEuclideanDistance(vector, centroids[c]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }
}
