package com.docindex.storage.index;

import com.docindex.storage.similarity.VectorSimilarity;

import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Бинарный формат снимка векторного индекса.
 * <p>
 * Формат:
 * <ul>
 *   <li>MAGIC (4 байта): "DIVX"</li>
 *   <li>VERSION (1 байт)</li>
 *   <li>VARIANT (1 байт): тег {@link IndexVariant}</li>
 *   <li>данные варианта</li>
 * </ul>
 */
public final class VectorIndexCodec {

    static final byte[] MAGIC = {'D', 'I', 'V', 'X'};
    static final byte FORMAT_VERSION = 1;

    private VectorIndexCodec() {
    }

    public static void write(VectorIndex index, OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        data.write(MAGIC);
        data.writeByte(FORMAT_VERSION);
        data.writeByte(index.variant().tag());
        index.save(data);
        data.flush();
    }

    public static VectorIndex read(
            InputStream in,
            VectorSimilarity vectorSimilarity,
            KMeansTrainer trainer,
            InsufficientTrainingPolicy policy) throws IOException {
        DataInputStream data = new DataInputStream(in);

        byte[] magic = new byte[MAGIC.length];
        data.readFully(magic);
        if (!Arrays.equals(magic, MAGIC)) {
            throw new IOException("Invalid magic bytes, not a vector index snapshot");
        }
        byte version = data.readByte();
        if (version != FORMAT_VERSION) {
            throw new IOException("Unsupported vector index format version: " + version);
        }

        IndexVariant variant;
        try {
            variant = IndexVariant.fromTag(data.readByte());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage(), e);
        }

        VectorIndex index;
        try {
            index = switch (variant) {
                case EXACT -> ExactVectorIndex.read(data, vectorSimilarity);
                case CLUSTERED -> ClusteredVectorIndex.read(data, vectorSimilarity, trainer, policy);
                case GRAPH -> GraphVectorIndex.read(data, vectorSimilarity);
            };
        } catch (IllegalArgumentException e) {
            throw new IOException("Corrupt " + variant + " index snapshot: " + e.getMessage(), e);
        }

        if (data.read() != -1) {
            throw new IOException("Unexpected trailing bytes after vector index snapshot");
        }
        return index;
    }

    static void writeVector(DataOutput out, float[] vector) throws IOException {
        for (float value : vector) {
            out.writeFloat(value);
        }
    }

    static float[] readVector(DataInput in, int dimension) throws IOException {
        float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = in.readFloat();
        }
        return vector;
    }

    static int readPositive(DataInput in, String field) throws IOException {
        int value = in.readInt();
        if (value <= 0) {
            throw new IOException("Invalid " + field + ": " + value);
        }
        return value;
    }

    static int readNonNegative(DataInput in, String field) throws IOException {
        int value = in.readInt();
        if (value < 0) {
            throw new IOException("Invalid " + field + ": " + value);
        }
        return value;
    }
}
