package com.docindex.main.embedding;

import com.docindex.common.exception.EmptyInputException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Feature-hashing embedding model: word tokens and character trigrams are hashed
 * into a fixed number of buckets, then the vector is L2-normalised.
 * Needs no model files, so it is the default provider.
 */
@Slf4j
public class HashingEmbeddingGenerator implements EmbeddingGenerator {

    private static final float TRIGRAM_WEIGHT = 0.5f;

    private final int dimension;

    public HashingEmbeddingGenerator(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Embedding dimension must be positive");
        }
        this.dimension = dimension;
        log.info("Initialized hashing embedding generator with dimension={}", dimension);
    }

    @Override
    public float[] encode(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException("Text to encode must not be blank");
        }

        float[] vector = new float[dimension];
        String[] tokens = text.toLowerCase(Locale.ROOT).split("(?U)\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            addFeature(vector, "w:" + token, 1f);

            String padded = "#" + token + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                addFeature(vector, "t:" + padded.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }

        VectorNormalizer.normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimension;
    }

    private void addFeature(float[] vector, String feature, float weight) {
        CRC32 crc = new CRC32();
        crc.update(feature.getBytes(StandardCharsets.UTF_8));
        long hash = crc.getValue();
        int index = (int) Math.floorMod(hash, (long) dimension);
        float sign = ((hash >>> 31) & 1L) == 0 ? 1f : -1f;
        vector[index] += sign * weight;
    }
}
