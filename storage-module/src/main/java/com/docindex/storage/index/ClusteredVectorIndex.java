package com.docindex.storage.index;

import com.docindex.common.exception.IndexNotTrainedException;
import com.docindex.common.exception.InsufficientTrainingDataException;
import com.docindex.storage.similarity.VectorSimilarity;
import lombok.extern.slf4j.Slf4j;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Кластерный (IVF-flat) индекс.
 * Обучение разбивает пространство на кластеры k-means; каждый вектор хранится в списке
 * ближайшего центроида, поиск просматривает {@code probes} ближайших списков.
 * До обучения добавление запрещено.
 */
@Slf4j
public class ClusteredVectorIndex implements VectorIndex {

    private final VectorSimilarity vectorSimilarity;
    private final KMeansTrainer trainer;
    private final int dimension;
    private final int clusters;
    private final int probes;
    private final InsufficientTrainingPolicy insufficientTrainingPolicy;

    /** Центроиды; null до обучения */
    private float[][] centroids;

    /** Инвертированные списки: номер кластера -> (id -> вектор) */
    private List<Map<Long, float[]>> invertedLists = List.of();

    /** id -> номер кластера */
    private final Map<Long, Integer> assignments = new LinkedHashMap<>();

    private boolean degraded;

    public ClusteredVectorIndex(
            VectorSimilarity vectorSimilarity,
            KMeansTrainer trainer,
            int dimension,
            int clusters,
            int probes,
            InsufficientTrainingPolicy insufficientTrainingPolicy) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive");
        }
        if (clusters <= 0 || probes <= 0) {
            throw new IllegalArgumentException("Cluster and probe counts must be positive");
        }
        this.vectorSimilarity = vectorSimilarity;
        this.trainer = trainer;
        this.dimension = dimension;
        this.clusters = clusters;
        this.probes = probes;
        this.insufficientTrainingPolicy = insufficientTrainingPolicy;
    }

    @Override
    public void train(List<float[]> sample) {
        if (isTrained()) {
            log.debug("Clustered index already trained, ignoring sample of {} vectors", sample.size());
            return;
        }
        if (sample.isEmpty()) {
            throw new InsufficientTrainingDataException(0, clusters);
        }
        sample.forEach(this::checkDimension);

        int effectiveClusters = clusters;
        if (sample.size() < clusters) {
            if (insufficientTrainingPolicy == InsufficientTrainingPolicy.FAIL) {
                throw new InsufficientTrainingDataException(sample.size(), clusters);
            }
            effectiveClusters = sample.size();
            degraded = true;
            log.warn("DEGRADED TRAINING: {} sample vectors for {} configured clusters, training {} clusters instead",
                    sample.size(), clusters, effectiveClusters);
        }

        log.info("Training clustered index: sample={}, clusters={}, dimension={}",
                sample.size(), effectiveClusters, dimension);
        float[][] trained = trainer.train(sample, effectiveClusters);
        installCentroids(trained);
        log.info("Clustered index trained with {} clusters", trained.length);
    }

    @Override
    public void add(float[] vector, long id) {
        if (!isTrained()) {
            throw new IndexNotTrainedException("Clustered index must be trained before adding vectors");
        }
        checkDimension(vector);
        if (assignments.containsKey(id)) {
            throw new IllegalArgumentException("Vector id already present in index: " + id);
        }
        int cluster = vectorSimilarity.nearest(vector, centroids);
        invertedLists.get(cluster).put(id, vector.clone());
        assignments.put(id, cluster);
    }

    @Override
    public boolean remove(long id) {
        Integer cluster = assignments.remove(id);
        if (cluster == null) {
            return false;
        }
        invertedLists.get(cluster).remove(id);
        return true;
    }

    @Override
    public List<Neighbor> search(float[] query, int k) {
        if (assignments.isEmpty() || k <= 0) {
            return List.of();
        }
        checkDimension(query);

        int probeCount = Math.min(probes, centroids.length);
        int[] probed = IntStream.range(0, centroids.length)
                .boxed()
                .sorted(Comparator.comparingDouble(c -> vectorSimilarity.squaredEuclideanDistance(query, centroids[c])))
                .limit(probeCount)
                .mapToInt(Integer::intValue)
                .toArray();

        NeighborCollector collector = new NeighborCollector(Math.min(k, assignments.size()));
        for (int cluster : probed) {
            for (Map.Entry<Long, float[]> entry : invertedLists.get(cluster).entrySet()) {
                collector.offer(entry.getKey(), vectorSimilarity.euclideanDistance(query, entry.getValue()));
            }
        }
        return collector.sorted();
    }

    @Override
    public boolean contains(long id) {
        return assignments.containsKey(id);
    }

    @Override
    public Optional<float[]> vector(long id) {
        Integer cluster = assignments.get(id);
        if (cluster == null) {
            return Optional.empty();
        }
        return Optional.of(invertedLists.get(cluster).get(id).clone());
    }

    @Override
    public Set<Long> ids() {
        return new LinkedHashSet<>(assignments.keySet());
    }

    @Override
    public int size() {
        return assignments.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public IndexState state() {
        return new IndexState(IndexVariant.CLUSTERED, centroids != null, assignments.size(), degraded);
    }

    public int clusterCount() {
        return centroids == null ? 0 : centroids.length;
    }

    @Override
    public void save(DataOutput out) throws IOException {
        out.writeInt(dimension);
        out.writeInt(clusters);
        out.writeInt(probes);
        out.writeBoolean(degraded);
        out.writeInt(clusterCount());
        for (int c = 0; c < clusterCount(); c++) {
            VectorIndexCodec.writeVector(out, centroids[c]);
        }
        out.writeInt(assignments.size());
        for (Map.Entry<Long, Integer> entry : assignments.entrySet()) {
            out.writeLong(entry.getKey());
            VectorIndexCodec.writeVector(out, invertedLists.get(entry.getValue()).get(entry.getKey()));
        }
    }

    static ClusteredVectorIndex read(
            DataInput in,
            VectorSimilarity vectorSimilarity,
            KMeansTrainer trainer,
            InsufficientTrainingPolicy policy) throws IOException {
        int dimension = VectorIndexCodec.readPositive(in, "dimension");
        int clusters = VectorIndexCodec.readPositive(in, "clusters");
        int probes = VectorIndexCodec.readPositive(in, "probes");
        boolean degraded = in.readBoolean();

        ClusteredVectorIndex index = new ClusteredVectorIndex(vectorSimilarity, trainer, dimension, clusters, probes, policy);
        index.degraded = degraded;

        int trainedClusters = VectorIndexCodec.readNonNegative(in, "trained cluster count");
        if (trainedClusters > 0) {
            float[][] centroids = new float[trainedClusters][];
            for (int c = 0; c < trainedClusters; c++) {
                centroids[c] = VectorIndexCodec.readVector(in, dimension);
            }
            index.installCentroids(centroids);
        }

        int count = VectorIndexCodec.readNonNegative(in, "vector count");
        if (count > 0 && trainedClusters == 0) {
            throw new IOException("Untrained clustered index snapshot cannot hold vectors");
        }
        for (int i = 0; i < count; i++) {
            long id = in.readLong();
            index.add(VectorIndexCodec.readVector(in, dimension), id);
        }
        log.info("Read clustered index with {} vectors in {} clusters, dimension={}", count, trainedClusters, dimension);
        return index;
    }

    private void installCentroids(float[][] trained) {
        List<Map<Long, float[]>> lists = new ArrayList<>(trained.length);
        for (int c = 0; c < trained.length; c++) {
            lists.add(new LinkedHashMap<>());
        }
        this.centroids = trained;
        this.invertedLists = lists;
    }

    private void checkDimension(float[] vector) {
        if (vector.length != dimension) {
            throw new IllegalArgumentException(
                String.format("Vector dimension mismatch. Expected: %d, got: %d", dimension, vector.length));
        }
    }
}
