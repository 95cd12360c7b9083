package com.docindex.main.embedding;

/**
 * Turns text into a fixed-dimension embedding vector.
 * Implementations are deterministic for a given model and input text.
 */
public interface EmbeddingGenerator {

    /**
     * Encode a text.
     *
     * @throws com.docindex.common.exception.EmptyInputException when the text is null or blank
     * @throws com.docindex.common.exception.ModelFailureException when inference fails
     */
    float[] encode(String text);

    /** Output dimension, fixed once the model is loaded */
    int dimension();

    String modelName();
}
