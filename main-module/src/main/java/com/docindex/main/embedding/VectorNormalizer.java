package com.docindex.main.embedding;

final class VectorNormalizer {

    private VectorNormalizer() {
    }

    /** L2-normalise in place; the zero vector is left untouched */
    static void normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vector.length; i++) {
                vector[i] /= (float) norm;
            }
        }
    }
}
