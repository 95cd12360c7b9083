package com.docindex.storage.index;

import com.docindex.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Точный индекс: линейный перебор всех векторов по L2 расстоянию.
 * Всегда обучен, обучение ничего не делает.
 */
@Slf4j
public class ExactVectorIndex implements VectorIndex {

    private final VectorSimilarity vectorSimilarity;
    private final int dimension;
    private final Map<Long, float[]> vectors = new LinkedHashMap<>();

    public ExactVectorIndex(VectorSimilarity vectorSimilarity, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        this.vectorSimilarity = vectorSimilarity;
        this.dimension = dimension;
    }

    @Override
    public void train(List<float[]> sample) {
        log.debug("Exact index needs no training, ignoring sample of {} vectors", sample.size());
    }

    @Override
    public void add(float[] vector, long id) {
        checkDimension(vector);
        if (vectors.containsKey(id)) {
            throw new IllegalArgumentException("Vector id already present in index: " + id);
        }
        vectors.put(id, vector.clone());
    }

    @Override
    public boolean remove(long id) {
        return vectors.remove(id) != null;
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (vectors.isEmpty() || k <= 0) {
            return List.of();
        }
        checkDimension(query);

        NeighborCollector collector = new NeighborCollector(Math.min(k, vectors.size()));
        for (Map.Entry<Long, float[]> entry : vectors.entrySet()) {
            collector.offer(entry.getKey(), vectorSimilarity.euclideanDistance(query, entry.getValue()));
        }
        return collector.sorted();
    }

    @Override
    public boolean contains(long id) {
        return vectors.containsKey(id);
    }

    @Override
    public Optional<float[]> vector(long id) {
        return Optional.ofNullable(vectors.get(id)).map(float[]::clone);
    }

    @Override
    public Set<Long> ids() {
        return new LinkedHashSet<>(vectors.keySet());
    }

    @Override
    public int size() {
        return vectors.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public IndexState state() {
        return new IndexState(IndexVariant.EXACT, true, vectors.size(), false);
    }

    @Override
    public void save(DataOutput out) throws IOException {
        out.writeInt(dimension);
        out.writeInt(vectors.size());
        for (Map.Entry<Long, float[]> entry : vectors.entrySet()) {
            out.writeLong(entry.getKey());
            VectorIndexCodec.writeVector(out, entry.getValue());
        }
    }

    static ExactVectorIndex read(DataInput in, VectorSimilarity vectorSimilarity) throws IOException {
        int dimension = VectorIndexCodec.readPositive(in, "dimension");
        ExactVectorIndex index = new ExactVectorIndex(vectorSimilarity, dimension);
        int count = VectorIndexCodec.readNonNegative(in, "vector count");
        for (int i = 0; i < count; i++) {
            long id = in.readLong();
            index.add(VectorIndexCodec.readVector(in, dimension), id);
        }
        log.info("Read exact index with {} vectors, dimension={}", count, dimension);
        return index;
    }

    private void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                String.format("Vector dimension mismatch. Expected: %d, got: %d", dimension, vector.length));
        }
    }
}
