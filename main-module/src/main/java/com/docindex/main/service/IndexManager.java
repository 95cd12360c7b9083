package com.docindex.main.service;

import com.docindex.common.exception.DocumentNotFoundException;
import com.docindex.common.exception.EmptyQueryException;
import com.docindex.common.exception.NoTextException;
import com.docindex.common.exception.PersistenceException;
import com.docindex.common.model.DocumentRecord;
import com.docindex.common.model.DocumentRef;
import com.docindex.common.model.SimilarDocument;
import com.docindex.main.config.IndexProperties;
import com.docindex.main.config.LoadFailurePolicy;
import com.docindex.main.embedding.EmbeddingGenerator;
import com.docindex.main.id.IdMap;
import com.docindex.main.model.IndexStats;
import com.docindex.main.model.IndexUpdateReport;
import com.docindex.storage.index.IndexState;
import com.docindex.storage.index.Neighbor;
import com.docindex.storage.index.VectorIndex;
import com.docindex.storage.index.VectorIndexConfig;
import com.docindex.storage.index.VectorIndexFactory;
import com.docindex.storage.kv.DocumentStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns the vector index together with the id map that ties internal ids to document keys.
 * <p>
 * Searches run under the read lock. Every mutation (add, remove, training, save, load)
 * runs under the write lock, so readers never see a vector without its key or the reverse.
 * Embedding happens outside the lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IndexManager {

    private final EmbeddingGenerator embeddingGenerator;
    private final VectorIndexFactory vectorIndexFactory;
    private final VectorIndexConfig vectorIndexConfig;
    private final IndexSnapshotStore snapshotStore;
    private final DocumentStore documentStore;
    private final DocumentTextSource textSource;
    private final IndexProperties indexProperties;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    /** Serializes update batches coming from the scheduler and the API */
    private final ReentrantLock updateLock = new ReentrantLock();

    private VectorIndex index;
    private IdMap idMap;
    private boolean dirty;

    @PostConstruct
    public void initialize() {
        load();
    }

    @PreDestroy
    public void shutdown() {
        lock.writeLock().lock();
        try {
            if (dirty) {
                log.info("Saving index with unsaved changes before shutdown");
                save();
            }
        } catch (PersistenceException e) {
            log.error("Failed to save index on shutdown: {}", e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Index a document, replacing any previous entry for the same key.
     * An index that still needs training does not take single documents: they stay
     * unindexed in the document store and are picked up by the next {@link #updateIndex(int)}.
     *
     * @return false when the text could not be encoded or the index is not trained yet;
     *         the index is left untouched
     */
    public boolean addDocument(String key, String text) {
        requireKey(key);
        if (!currentState().trained()) {
            log.warn("Index is not trained yet, document {} is left for the next update", key);
            return false;
        }

        float[] vector;
        try {
            vector = embeddingGenerator.encode(text);
        } catch (RuntimeException e) {
            log.error("Failed to encode document {}: {}", key, e.getMessage());
            return false;
        }

        lock.writeLock().lock();
        try {
            if (!index.isTrained()) {
                log.warn("Index was replaced by an untrained one, document {} is left for the next update", key);
                return false;
            }
            insert(key, vector);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove a document from the index. Absent keys are a successful no-op.
     */
    public boolean removeDocument(String key) {
        requireKey(key);
        lock.writeLock().lock();
        try {
            Optional<Long> id = idMap.idOf(key);
            if (id.isEmpty()) {
                log.debug("Document {} is not indexed, nothing to remove", key);
                return true;
            }

            float[] vector = index.vector(id.get()).orElse(null);
            try {
                index.remove(id.get());
                idMap.removeById(id.get());
                documentStore.markIndexed(key, false);
            } catch (RuntimeException e) {
                log.error("Failed to remove document {}, rolling back", key, e);
                if (vector != null && !index.contains(id.get())) {
                    index.add(vector, id.get());
                }
                if (idMap.keyOf(id.get()).isEmpty()) {
                    idMap.put(id.get(), key);
                }
                throw e;
            }
            dirty = true;
            log.info("Document {} removed from index, id={}", key, id.get());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<SimilarDocument> findSimilarByVector(float[] vector, int k) {
        lock.readLock().lock();
        try {
            return toDocuments(index.search(vector, k));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Documents similar to a stored one. The document's text is re-encoded on every call and
     * the document itself is never part of the result.
     */
    public List<SimilarDocument> findSimilarByKey(String key, int k) {
        DocumentRecord document = documentStore.get(key)
                .orElseThrow(() -> new DocumentNotFoundException(key));
        String text = textSource.textOf(document)
                .orElseThrow(() -> new NoTextException(key));
        if (k <= 0) {
            return List.of();
        }

        float[] vector = embeddingGenerator.encode(text);
        int limit = k == Integer.MAX_VALUE ? k : k + 1;
        return findSimilarByVector(vector, limit).stream()
                .filter(similar -> !similar.key().equals(key))
                .limit(k)
                .toList();
    }

    public List<SimilarDocument> findSimilarByText(String text, int k) {
        if (text == null || text.isBlank()) {
            throw new EmptyQueryException();
        }
        return findSimilarByVector(embeddingGenerator.encode(text), k);
    }

    /**
     * Index up to {@code batchSize} unindexed documents taken from the document store.
     */
    public IndexUpdateReport updateIndex(int batchSize) {
        List<DocumentRef> pending = documentStore.listUnindexed(batchSize).stream()
                .map(document -> new DocumentRef(document.key(), textSource.textOf(document).orElse(null)))
                .toList();
        return updateIndex(pending, batchSize);
    }

    /**
     * Index up to {@code batchSize} of the given documents. An untrained index is trained first on a
     * sample of the pending texts. Per-document failures are counted and skipped; a snapshot is
     * written every {@code checkpoint-interval} additions and once at the end.
     *
     * @throws com.docindex.common.exception.InsufficientTrainingDataException when training is
     *         required and the sample is too small under the FAIL policy
     * @throws PersistenceException when a checkpoint cannot be written
     */
    public IndexUpdateReport updateIndex(List<DocumentRef> pending, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive");
        }
        List<DocumentRef> batch = pending.subList(0, Math.min(batchSize, pending.size()));
        if (batch.isEmpty()) {
            log.info("No documents to index");
            return IndexUpdateReport.empty();
        }

        updateLock.lock();
        try {
            log.info("Updating index with {} documents", batch.size());
            Map<String, float[]> encoded = new HashMap<>();
            trainIfNeeded(batch, encoded);

            int added = 0;
            int failed = 0;
            int checkpointInterval = indexProperties.getCheckpointInterval();
            for (DocumentRef ref : batch) {
                float[] vector = encoded.remove(ref.key());
                try {
                    if (vector == null) {
                        vector = embeddingGenerator.encode(ref.text());
                    }
                    lock.writeLock().lock();
                    try {
                        insert(ref.key(), vector);
                    } finally {
                        lock.writeLock().unlock();
                    }
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to index document {}: {}", ref.key(), e.getMessage());
                    continue;
                }

                added++;
                if (added % checkpointInterval == 0) {
                    log.debug("Checkpoint after {} additions", added);
                    save();
                }
            }

            if (added > 0) {
                save();
            }

            IndexUpdateReport report = new IndexUpdateReport(batch.size(), added, failed, currentState().degraded());
            log.info("Index update finished: {}", report);
            return report;
        } finally {
            updateLock.unlock();
        }
    }

    public void save() {
        lock.writeLock().lock();
        try {
            snapshotStore.write(index, idMap.snapshot());
            dirty = false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replace the in-memory state with the persisted snapshot, or an empty index when there is none.
     * Unreadable snapshots either start a fresh index or fail, depending on {@code load-failure}.
     * Stored documents flagged as indexed but absent from the loaded index are queued again.
     */
    public void load() {
        lock.writeLock().lock();
        try {
            Optional<IndexSnapshotStore.LoadedIndex> loaded;
            try {
                loaded = snapshotStore.read(vectorIndexConfig);
            } catch (PersistenceException e) {
                if (indexProperties.getLoadFailure() == LoadFailurePolicy.FAIL) {
                    throw e;
                }
                log.error("Failed to load index snapshot, starting with an empty index: {}", e.getMessage(), e);
                loaded = Optional.empty();
            }

            if (loaded.isPresent()) {
                index = loaded.get().index();
                idMap = IdMap.restore(loaded.get().idMap());
                log.info("Loaded {} index with {} documents, nextId={}", index.variant(), index.size(), idMap.nextId());
            } else {
                index = vectorIndexFactory.create(vectorIndexConfig);
                idMap = new IdMap();
                log.info("Created empty {} index", index.variant());
            }
            dirty = false;
            requeueMissingDocuments();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public IndexStats stats() {
        lock.readLock().lock();
        try {
            IndexState state = index.state();
            return new IndexStats(state.variant(), state.trained(), state.degraded(), state.count(),
                    idMap.nextId(), index.dimension(), dirty);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> indexedKeys() {
        lock.readLock().lock();
        try {
            return idMap.keys();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Caller holds the write lock */
    private void requeueMissingDocuments() {
        Set<String> keys = idMap.keys();
        int requeued = 0;
        for (DocumentRecord document : documentStore.listIndexed()) {
            if (!keys.contains(document.key())) {
                documentStore.markIndexed(document.key(), false);
                requeued++;
            }
        }
        if (requeued > 0) {
            log.warn("{} documents flagged as indexed are missing from the loaded index, queued for the next update",
                    requeued);
        }
    }

    private void trainIfNeeded(List<DocumentRef> batch, Map<String, float[]> encoded) {
        if (currentState().trained()) {
            return;
        }

        int sampleSize = Math.min(indexProperties.getTrainingSampleSize(), batch.size());
        List<float[]> sample = new ArrayList<>(sampleSize);
        for (DocumentRef ref : batch.subList(0, sampleSize)) {
            try {
                float[] vector = embeddingGenerator.encode(ref.text());
                encoded.put(ref.key(), vector);
                sample.add(vector);
            } catch (RuntimeException e) {
                log.warn("Skipping document {} in training sample: {}", ref.key(), e.getMessage());
            }
        }

        log.info("Training index with {} sample vectors", sample.size());
        lock.writeLock().lock();
        try {
            index.train(sample);
            dirty = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Store the vector under a fresh id, replacing the key's previous entry. Either every step
     * succeeds or the previous state is restored. Caller holds the write lock.
     */
    private void insert(String key, float[] vector) {
        Optional<Long> previousId = idMap.idOf(key);
        float[] previousVector = previousId.flatMap(index::vector).orElse(null);
        long id = -1;

        try {
            if (previousId.isPresent()) {
                index.remove(previousId.get());
                idMap.removeById(previousId.get());
            }
            id = idMap.allocate();
            index.add(vector, id);
            idMap.put(id, key);
            documentStore.markIndexed(key, true);
        } catch (RuntimeException e) {
            log.error("Failed to add document {}, rolling back", key, e);
            if (id > 0) {
                idMap.removeById(id);
                index.remove(id);
            }
            if (previousId.isPresent() && previousVector != null) {
                if (!index.contains(previousId.get())) {
                    index.add(previousVector, previousId.get());
                }
                if (idMap.keyOf(previousId.get()).isEmpty()) {
                    idMap.put(previousId.get(), key);
                }
            }
            throw e;
        }

        dirty = true;
        if (previousId.isPresent()) {
            log.info("Document {} re-indexed, id {} -> {}", key, previousId.get(), id);
        } else {
            log.info("Document {} added to index, id={}", key, id);
        }
    }

    private List<SimilarDocument> toDocuments(List<Neighbor> neighbors) {
        List<SimilarDocument> result = new ArrayList<>(neighbors.size());
        for (Neighbor neighbor : neighbors) {
            Optional<String> key = idMap.keyOf(neighbor.id());
            if (key.isPresent()) {
                result.add(new SimilarDocument(key.get(), neighbor.distance()));
            } else {
                log.warn("Dropping search hit with stale id {}", neighbor.id());
            }
        }
        return result;
    }

    private IndexState currentState() {
        lock.readLock().lock();
        try {
            return index.state();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Document key must not be blank");
        }
    }
}
