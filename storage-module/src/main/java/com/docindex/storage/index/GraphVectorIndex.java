package com.docindex.storage.index;

import com.docindex.storage.similarity.VectorSimilarity;
import com.github.jelmerk.knn.DistanceFunctions;
import com.github.jelmerk.knn.hnsw.HnswIndex;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
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
 * Графовый индекс HNSW на чистой Java библиотеке hnswlib.
 * Всегда обучен; ёмкость графа увеличивается автоматически.
 * Копии векторов хранятся отдельно для отката и точного пересчёта расстояний.
 */
@Slf4j
public class GraphVectorIndex implements VectorIndex {

    private final VectorSimilarity vectorSimilarity;
    private final int dimension;

    // Параметры HNSW
    private final int m;
    private final int ef;
    private final int efConstruction;

    private HnswIndex<Long, float[], VectorItem, Float> hnswIndex;
    private final Map<Long, float[]> vectors = new LinkedHashMap<>();

    /** Текущая ёмкость графа */
    private int capacity;

    /** Число вставок в граф, включая удалённые узлы */
    private int insertions;

    public GraphVectorIndex(VectorSimilarity vectorSimilarity, int dimension, int m, int ef, int efConstruction, int initialCapacity) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("Initial capacity must be positive");
        }
        this.vectorSimilarity = vectorSimilarity;
        this.dimension = dimension;
        this.m = m;
        this.ef = ef;
        this.efConstruction = efConstruction;
        this.capacity = initialCapacity;
        this.hnswIndex = HnswIndex.newBuilder(dimension, DistanceFunctions.FLOAT_EUCLIDEAN_DISTANCE, initialCapacity)
                .withM(m)
                .withEf(ef)
                .withEfConstruction(efConstruction)
                .withRemoveEnabled()
                .build();
        log.info("Initialized HNSW index with dimension={}, m={}, ef={}, efConstruction={}, capacity={}",
                dimension, m, ef, efConstruction, initialCapacity);
    }

    @Override
    public void train(List<float[]> sample) {
        log.debug("Graph index needs no training, ignoring sample of {} vectors", sample.size());
    }

    @Override
    public void add(float[] vector, long id) {
        checkDimension(vector);
        if (vectors.containsKey(id)) {
            throw new IllegalArgumentException("Vector id already present in index: " + id);
        }
        ensureCapacity();

        float[] copy = vector.clone();
        if (!hnswIndex.add(new VectorItem(id, copy))) {
            throw new IllegalStateException("HNSW index rejected vector id " + id);
        }
        insertions++;
        vectors.put(id, copy);
    }

    @Override
    public boolean remove(long id) {
        if (vectors.remove(id) == null) {
            return false;
        }
        hnswIndex.remove(id, 0);
        return true;
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (vectors.isEmpty() || k <= 0) {
            return List.of();
        }
        checkDimension(query);

        int limit = Math.min(k, vectors.size());
        NeighborCollector collector = new NeighborCollector(limit);
        for (var result : hnswIndex.findNearest(query, limit)) {
            long id = result.item().id();
            float[] stored = vectors.get(id);
            if (stored != null) {
                collector.offer(id, vectorSimilarity.euclideanDistance(query, stored));
            }
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
        return new IndexState(IndexVariant.GRAPH, true, vectors.size(), false);
    }

    @Override
    public void save(DataOutput out) throws IOException {
        out.writeInt(dimension);
        out.writeInt(m);
        out.writeInt(ef);
        out.writeInt(efConstruction);
        out.writeInt(capacity);
        out.writeInt(insertions);
        out.writeInt(vectors.size());
        for (Map.Entry<Long, float[]> entry : vectors.entrySet()) {
            out.writeLong(entry.getKey());
            VectorIndexCodec.writeVector(out, entry.getValue());
        }

        // hnswlib закрывает поток после записи, поэтому граф пишется через буфер
        ByteArrayOutputStream graph = new ByteArrayOutputStream();
        hnswIndex.save(graph);
        byte[] bytes = graph.toByteArray();
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    static GraphVectorIndex read(DataInput in, VectorSimilarity vectorSimilarity) throws IOException {
        int dimension = VectorIndexCodec.readPositive(in, "dimension");
        int m = VectorIndexCodec.readPositive(in, "m");
        int ef = VectorIndexCodec.readPositive(in, "ef");
        int efConstruction = VectorIndexCodec.readPositive(in, "efConstruction");
        int capacity = VectorIndexCodec.readPositive(in, "capacity");
        int insertions = VectorIndexCodec.readNonNegative(in, "insertions");

        GraphVectorIndex index = new GraphVectorIndex(vectorSimilarity, dimension, m, ef, efConstruction, capacity);
        int count = VectorIndexCodec.readNonNegative(in, "vector count");
        for (int i = 0; i < count; i++) {
            long id = in.readLong();
            index.vectors.put(id, VectorIndexCodec.readVector(in, dimension));
        }

        byte[] bytes = new byte[VectorIndexCodec.readNonNegative(in, "graph length")];
        in.readFully(bytes);
        index.hnswIndex = HnswIndex.load(new ByteArrayInputStream(bytes));
        index.insertions = insertions;

        if (index.hnswIndex.size() != count) {
            throw new IOException(String.format(
                "HNSW graph holds %d items but snapshot lists %d vectors", index.hnswIndex.size(), count));
        }
        log.info("Read HNSW index with {} vectors, dimension={}", count, dimension);
        return index;
    }

    private void ensureCapacity() {
        if (insertions < capacity) {
            return;
        }
        int newCapacity = capacity * 2;
        hnswIndex.resize(newCapacity);
        log.info("Resized HNSW index capacity from {} to {}", capacity, newCapacity);
        capacity = newCapacity;
    }

    private void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                String.format("Vector dimension mismatch. Expected: %d, got: %d", dimension, vector.length));
        }
    }
}
