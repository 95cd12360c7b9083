package com.docindex.main.embedding;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.docindex.common.exception.EmptyInputException;
import com.docindex.common.exception.ModelFailureException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Sentence-transformer model exported to ONNX ({@code model.onnx} + {@code tokenizer.json}).
 * Token embeddings are mean-pooled over the attention mask and L2-normalised.
 */
@Slf4j
public class OnnxEmbeddingGenerator implements EmbeddingGenerator, AutoCloseable {

    private static final String PROBE_TEXT = "dimension probe";

    private final String modelName;
    private final int maxTokens;
    private final OrtEnvironment env;
    private final OrtSession session;
    private final HuggingFaceTokenizer tokenizer;
    private final int dimension;

    public OnnxEmbeddingGenerator(Path modelDirectory, int maxTokens, int intraOpThreads) {
        Path modelPath = modelDirectory.resolve("model.onnx");
        Path tokenizerPath = modelDirectory.resolve("tokenizer.json");
        if (!Files.isRegularFile(modelPath) || !Files.isRegularFile(tokenizerPath)) {
            throw new ModelFailureException("ONNX model files not found in " + modelDirectory);
        }

        this.modelName = modelDirectory.getFileName().toString();
        this.maxTokens = maxTokens;
        try {
            this.env = OrtEnvironment.getEnvironment();
            this.session = env.createSession(modelPath.toString(), OrtInitializer.initializeOrt(intraOpThreads));
            this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);
        } catch (OrtException | IOException e) {
            throw new ModelFailureException("Failed to load ONNX embedding model from " + modelDirectory, e);
        }

        this.dimension = infer(PROBE_TEXT).length;
        log.info("Loaded ONNX embedding model: {}, dimension={}", modelPath, dimension);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @Override
    public float[] encode(String text) {
        if (text == null || text.isBlank()) {
            throw new EmptyInputException("Text to encode must not be blank");
        }
        return infer(text);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return modelName;
    }

    private float[] infer(String text) {
        Encoding encoding = tokenizer.encode(text);
        long[] ids = encoding.getIds();
        long[] mask = encoding.getAttentionMask();
        int length = Math.min(ids.length, maxTokens);

        long[][] inputIds = new long[1][length];
        long[][] attentionMask = new long[1][length];
        long[][] tokenTypes = new long[1][length];
        System.arraycopy(ids, 0, inputIds[0], 0, length);
        System.arraycopy(mask, 0, attentionMask[0], 0, length);

        try (OnnxTensor inputIdsTensor = OnnxTensor.createTensor(env, inputIds);
             OnnxTensor attentionMaskTensor = OnnxTensor.createTensor(env, attentionMask);
             OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypes)) {

            Map<String, OnnxTensor> inputs = new HashMap<>();
            if (session.getInputNames().contains("input_ids")) {
                inputs.put("input_ids", inputIdsTensor);
            }
            if (session.getInputNames().contains("attention_mask")) {
                inputs.put("attention_mask", attentionMaskTensor);
            }
            if (session.getInputNames().contains("token_type_ids")) {
                inputs.put("token_type_ids", tokenTypeTensor);
            }

            try (OrtSession.Result result = session.run(inputs)) {
                float[][][] embeddings = (float[][][]) result.get(0).getValue();
                float[] pooled = meanPool(embeddings[0], attentionMask[0]);
                VectorNormalizer.normalize(pooled);
                return pooled;
            }
        } catch (OrtException | ClassCastException e) {
            throw new ModelFailureException("ONNX inference failed", e);
        }
    }

    private static float[] meanPool(float[][] tokenVectors, long[] attentionMask) {
        int hiddenDim = tokenVectors[0].length;
        float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVectors[i][j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }

    @Override
    public void close() throws OrtException {
        tokenizer.close();
        session.close();
    }
}
