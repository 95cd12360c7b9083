package com.docindex.main.service;

import com.docindex.common.exception.DocumentNotFoundException;
import com.docindex.common.exception.EmptyQueryException;
import com.docindex.common.exception.InsufficientTrainingDataException;
import com.docindex.common.exception.NoTextException;
import com.docindex.common.exception.PersistenceException;
import com.docindex.common.model.DocumentRecord;
import com.docindex.common.model.DocumentRef;
import com.docindex.common.model.SimilarDocument;
import com.docindex.main.config.IndexConfig;
import com.docindex.main.config.IndexProperties;
import com.docindex.main.config.LoadFailurePolicy;
import com.docindex.main.model.IndexStats;
import com.docindex.main.model.IndexUpdateReport;
import com.docindex.storage.index.IndexVariant;
import com.docindex.storage.index.InsufficientTrainingPolicy;
import com.docindex.storage.index.VectorIndexFactory;
import com.docindex.storage.similarity.VectorSimilarity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Unit-тесты для IndexManager
 */
class IndexManagerTest {

    @TempDir
    Path tempDir;

    private final VectorIndexFactory vectorIndexFactory = new VectorIndexFactory(new VectorSimilarity());
    private InMemoryDocumentStore documentStore;
    private CoordinateEmbeddingGenerator embeddingGenerator;
    private IndexProperties properties;

    @BeforeEach
    void setUp() {
        documentStore = new InMemoryDocumentStore();
        embeddingGenerator = new CoordinateEmbeddingGenerator(2);
        properties = new IndexProperties();
        properties.setDirectory(tempDir.toString());
    }

    private IndexManager newManager() {
        return newManager(new IndexSnapshotStore(properties, vectorIndexFactory));
    }

    private IndexManager newManager(IndexSnapshotStore snapshotStore) {
        IndexManager manager = new IndexManager(
                embeddingGenerator,
                vectorIndexFactory,
                IndexConfig.toVectorIndexConfig(properties, embeddingGenerator.dimension()),
                snapshotStore,
                documentStore,
                new AbstractTextSource(),
                properties);
        manager.initialize();
        return manager;
    }

    private IndexManager managerWithAbc() {
        IndexManager manager = newManager();
        assertThat(manager.addDocument("A", "0,0")).isTrue();
        assertThat(manager.addDocument("B", "1,0")).isTrue();
        assertThat(manager.addDocument("C", "5,5")).isTrue();
        return manager;
    }

    private static List<String> keys(List<SimilarDocument> documents) {
        return documents.stream().map(SimilarDocument::key).toList();
    }

    private static void assertBijection(IndexManager manager) {
        IndexStats stats = manager.stats();
        assertThat(manager.indexedKeys()).hasSize(stats.count());
    }

    @Test
    @DisplayName("Поиск возвращает ближайшие документы по возрастанию расстояния")
    void shouldReturnNearestDocumentsInAscendingDistance() {
        IndexManager manager = managerWithAbc();

        List<SimilarDocument> result = manager.findSimilarByVector(new float[]{0f, 0f}, 2);

        assertThat(keys(result)).containsExactly("A", "B");
        assertThat(result.get(0).distance()).isZero();
        assertThat(result.get(1).distance()).isEqualTo(1.0);
        assertThat(manager.findSimilarByVector(new float[]{0f, 0f}, 3).get(2).distance())
                .isCloseTo(Math.sqrt(50), offset(1e-6));
    }

    @Test
    @DisplayName("Удалённый документ не попадает в результаты поиска")
    void shouldExcludeRemovedDocument() {
        IndexManager manager = managerWithAbc();

        assertThat(manager.removeDocument("B")).isTrue();

        assertThat(keys(manager.findSimilarByVector(new float[]{0f, 0f}, 2))).containsExactly("A", "C");
        assertThat(manager.stats().count()).isEqualTo(2);
        assertBijection(manager);
    }

    @Test
    void shouldRestoreCountAfterAddThenRemoveWithoutReusingIds() {
        IndexManager manager = managerWithAbc();
        IndexStats before = manager.stats();

        manager.addDocument("D", "2,2");
        manager.removeDocument("D");

        IndexStats after = manager.stats();
        assertThat(after.count()).isEqualTo(before.count());
        assertThat(manager.indexedKeys()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(after.nextId()).isEqualTo(before.nextId() + 1);
    }

    @Test
    void shouldReplaceVectorWhenKeyIsAddedAgain() {
        IndexManager manager = managerWithAbc();

        manager.addDocument("A", "9,9");

        assertThat(manager.stats().count()).isEqualTo(3);
        List<SimilarDocument> nearest = manager.findSimilarByVector(new float[]{9f, 9f}, 1);
        assertThat(nearest).containsExactly(new SimilarDocument("A", 0.0));
        assertThat(keys(manager.findSimilarByVector(new float[]{0f, 0f}, 1))).containsExactly("B");
        assertBijection(manager);
    }

    @Test
    void shouldLeaveIndexUntouchedWhenEncodingFails() {
        IndexManager manager = managerWithAbc();
        IndexStats before = manager.stats();

        assertThat(manager.addDocument("A", "fail")).isFalse();
        assertThat(manager.addDocument("D", "  ")).isFalse();

        assertThat(manager.stats()).isEqualTo(before);
        assertThat(manager.findSimilarByVector(new float[]{0f, 0f}, 1)).containsExactly(new SimilarDocument("A", 0.0));
    }

    @Test
    void shouldTreatRemovalOfUnknownKeyAsSuccess() {
        IndexManager manager = managerWithAbc();

        assertThat(manager.removeDocument("missing")).isTrue();
        assertThat(manager.stats().count()).isEqualTo(3);
    }

    @Test
    void shouldReturnEmptyResultOnEmptyIndex() {
        IndexManager manager = newManager();

        assertThat(manager.findSimilarByVector(new float[]{0f, 0f}, 5)).isEmpty();
        assertThat(manager.findSimilarByText("1,1", 5)).isEmpty();
    }

    @Test
    void shouldBoundResultsByCount() {
        IndexManager manager = managerWithAbc();

        List<SimilarDocument> result = manager.findSimilarByVector(new float[]{1f, 1f}, 10);

        assertThat(result).hasSize(3);
        assertThat(result).extracting(SimilarDocument::distance).isSorted();
        assertThat(manager.findSimilarByVector(new float[]{1f, 1f}, 0)).isEmpty();
    }

    @Test
    @DisplayName("Поиск по ключу никогда не возвращает сам документ")
    void shouldExcludeQueryDocumentFromSimilarByKey() {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        documentStore.putAbstract("C", "5,5");
        IndexManager manager = newManager();
        manager.updateIndex(10);

        List<SimilarDocument> result = manager.findSimilarByKey("A", 10);

        assertThat(keys(result)).containsExactly("B", "C");
        assertThat(keys(manager.findSimilarByKey("A", 1))).containsExactly("B");
    }

    @Test
    void shouldExcludeQueryDocumentForLargestK() {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        documentStore.putAbstract("C", "5,5");
        IndexManager manager = newManager();
        manager.updateIndex(10);

        assertThat(keys(manager.findSimilarByKey("A", Integer.MAX_VALUE))).containsExactly("B", "C");
    }

    @Test
    void shouldReencodeCurrentTextForSimilarByKey() {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        documentStore.putAbstract("C", "5,5");
        IndexManager manager = newManager();
        manager.updateIndex(10);

        documentStore.putAbstract("A", "5,4");

        assertThat(keys(manager.findSimilarByKey("A", 1))).containsExactly("C");
    }

    @Test
    void shouldFailSimilarByKeyForUnknownDocumentOrMissingText() {
        documentStore.putAbstract("empty", "   ");
        IndexManager manager = newManager();

        assertThatThrownBy(() -> manager.findSimilarByKey("missing", 5))
                .isInstanceOf(DocumentNotFoundException.class);
        assertThatThrownBy(() -> manager.findSimilarByKey("empty", 5))
                .isInstanceOf(NoTextException.class);
    }

    @Test
    void shouldRejectBlankQuery() {
        IndexManager manager = managerWithAbc();

        assertThatThrownBy(() -> manager.findSimilarByText(" ", 5)).isInstanceOf(EmptyQueryException.class);
        assertThatThrownBy(() -> manager.findSimilarByText(null, 5)).isInstanceOf(EmptyQueryException.class);
    }

    @Test
    void shouldNotifyDocumentStoreOnAddAndRemove() {
        documentStore.putAbstract("A", "0,0");
        IndexManager manager = newManager();

        manager.addDocument("A", "0,0");
        assertThat(documentStore.get("A").orElseThrow().indexed()).isTrue();

        manager.removeDocument("A");
        assertThat(documentStore.get("A").orElseThrow().indexed()).isFalse();
    }

    @Test
    @DisplayName("Ошибка уведомления хранилища откатывает добавление")
    void shouldRollBackAddWhenStoreNotificationFails() {
        IndexManager manager = managerWithAbc();
        documentStore.failMarkIndexedFor("A");
        documentStore.failMarkIndexedFor("D");

        assertThatThrownBy(() -> manager.addDocument("D", "2,2")).isInstanceOf(PersistenceException.class);
        assertThatThrownBy(() -> manager.addDocument("A", "7,7")).isInstanceOf(PersistenceException.class);

        assertThat(manager.indexedKeys()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(manager.findSimilarByVector(new float[]{0f, 0f}, 1)).containsExactly(new SimilarDocument("A", 0.0));
        assertBijection(manager);
    }

    @Test
    void shouldRollBackRemoveWhenStoreNotificationFails() {
        IndexManager manager = managerWithAbc();
        documentStore.failMarkIndexedFor("B");

        assertThatThrownBy(() -> manager.removeDocument("B")).isInstanceOf(PersistenceException.class);

        assertThat(keys(manager.findSimilarByVector(new float[]{0f, 0f}, 2))).containsExactly("A", "B");
        assertBijection(manager);
    }

    @Test
    void shouldIsolatePerDocumentFailuresInUpdate() {
        IndexManager manager = newManager();
        List<DocumentRef> pending = List.of(
                new DocumentRef("A", "0,0"),
                new DocumentRef("bad", "fail"),
                new DocumentRef("blank", null),
                new DocumentRef("B", "1,0"));

        IndexUpdateReport report = manager.updateIndex(pending, 10);

        assertThat(report).isEqualTo(new IndexUpdateReport(4, 2, 2, false));
        assertThat(manager.indexedKeys()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void shouldProcessAtMostBatchSizeDocuments() {
        IndexManager manager = newManager();
        List<DocumentRef> pending = List.of(
                new DocumentRef("A", "0,0"), new DocumentRef("B", "1,0"), new DocumentRef("C", "5,5"));

        IndexUpdateReport report = manager.updateIndex(pending, 2);

        assertThat(report.requested()).isEqualTo(2);
        assertThat(manager.indexedKeys()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void shouldPullUnindexedDocumentsFromStore() {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        documentStore.putAbstract("C", null);
        IndexManager manager = newManager();

        IndexUpdateReport report = manager.updateIndex(10);

        assertThat(report).isEqualTo(new IndexUpdateReport(3, 2, 1, false));
        assertThat(documentStore.listUnindexed(10)).extracting(DocumentRecord::key).containsExactly("C");
        assertThat(manager.updateIndex(10).added()).isZero();
    }

    @Test
    @DisplayName("Контрольная точка каждые 10 добавлений и в конце пакета")
    void shouldCheckpointEveryIntervalAndAtEnd() {
        IndexSnapshotStore snapshotStore = spy(new IndexSnapshotStore(properties, vectorIndexFactory));
        IndexManager manager = newManager(snapshotStore);
        List<DocumentRef> pending = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            pending.add(new DocumentRef("doc-" + i, i + ",0"));
        }

        IndexUpdateReport report = manager.updateIndex(pending, 50);

        assertThat(report.added()).isEqualTo(25);
        verify(snapshotStore, times(3)).write(any(), any());
        assertThat(manager.stats().dirty()).isFalse();
        assertThat(tempDir.resolve(IndexSnapshotStore.VECTORS_FILE)).exists();
        assertThat(tempDir.resolve(IndexSnapshotStore.ID_MAP_FILE)).exists();
    }

    @Test
    void shouldNotSaveWhenNothingWasAdded() {
        IndexSnapshotStore snapshotStore = spy(new IndexSnapshotStore(properties, vectorIndexFactory));
        IndexManager manager = newManager(snapshotStore);

        manager.updateIndex(List.of(new DocumentRef("bad", "fail")), 10);

        verify(snapshotStore, times(0)).write(any(), any());
    }

    @Test
    void shouldRestoreStateFromSnapshot() {
        IndexManager manager = managerWithAbc();
        manager.removeDocument("B");
        manager.save();
        IndexStats saved = manager.stats();

        IndexManager restored = newManager();

        assertThat(restored.stats()).isEqualTo(saved);
        assertThat(restored.indexedKeys()).containsExactlyInAnyOrder("A", "C");
        assertThat(restored.findSimilarByVector(new float[]{0f, 0f}, 3))
                .isEqualTo(manager.findSimilarByVector(new float[]{0f, 0f}, 3));

        restored.addDocument("D", "2,2");
        assertThat(restored.stats().nextId()).isEqualTo(saved.nextId() + 1);
    }

    @Test
    void shouldStartFreshWhenSnapshotIsCorrupt() throws Exception {
        Files.write(tempDir.resolve(IndexSnapshotStore.VECTORS_FILE), new byte[]{1, 2, 3});

        IndexManager manager = newManager();

        assertThat(manager.stats().count()).isZero();
        assertThat(manager.stats().nextId()).isEqualTo(1L);
    }

    @Test
    @DisplayName("После потери снимка документы снова попадают в очередь индексации")
    void shouldRequeueDocumentsLostWithCorruptSnapshot() throws Exception {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        newManager().updateIndex(10);
        assertThat(documentStore.listUnindexed(10)).isEmpty();
        Files.write(tempDir.resolve(IndexSnapshotStore.VECTORS_FILE), new byte[]{1, 2, 3});

        IndexManager restarted = newManager();

        assertThat(restarted.stats().count()).isZero();
        assertThat(documentStore.get("A").orElseThrow().indexed()).isFalse();
        assertThat(documentStore.listUnindexed(10)).extracting(DocumentRecord::key).containsExactly("A", "B");
        assertThat(restarted.updateIndex(10).added()).isEqualTo(2);
        assertThat(restarted.indexedKeys()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void shouldRequeueDocumentsPrunedWhileReconcilingSnapshot() throws Exception {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        documentStore.putAbstract("C", "5,5");
        IndexManager manager = newManager();
        manager.updateIndex(10);
        long nextId = manager.stats().nextId();
        Files.delete(tempDir.resolve(IndexSnapshotStore.ID_MAP_FILE));

        IndexManager restarted = newManager();

        assertThat(restarted.stats().count()).isZero();
        assertThat(documentStore.listUnindexed(10)).extracting(DocumentRecord::key).containsExactly("A", "B", "C");

        restarted.updateIndex(10);

        assertThat(restarted.indexedKeys()).containsExactlyInAnyOrder("A", "B", "C");
        assertThat(restarted.stats().nextId()).isEqualTo(nextId + 3);
    }

    @Test
    void shouldKeepFlagsOfDocumentsPresentInLoadedIndex() {
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "1,0");
        newManager().updateIndex(10);

        newManager();

        assertThat(documentStore.listUnindexed(10)).isEmpty();
    }

    @Test
    void shouldFailStartupOnCorruptSnapshotWhenConfigured() throws Exception {
        Files.write(tempDir.resolve(IndexSnapshotStore.VECTORS_FILE), new byte[]{1, 2, 3});
        properties.setLoadFailure(LoadFailurePolicy.FAIL);

        assertThatThrownBy(this::newManager).isInstanceOf(PersistenceException.class);
    }

    @Test
    void shouldSaveUnsavedChangesOnShutdown() {
        IndexManager manager = managerWithAbc();
        assertThat(manager.stats().dirty()).isTrue();

        manager.shutdown();

        assertThat(manager.stats().dirty()).isFalse();
        assertThat(newManager().indexedKeys()).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    @DisplayName("Кластерный индекс: 5 документов при 100 кластерах и политике FAIL")
    void shouldSurfaceInsufficientTrainingDataUnderFailPolicy() {
        properties.setVariant(IndexVariant.CLUSTERED);
        properties.getClustered().setClusters(100);
        properties.getClustered().setInsufficientTraining(InsufficientTrainingPolicy.FAIL);
        IndexManager manager = newManager();

        assertThatThrownBy(() -> manager.updateIndex(fivePending(), 50))
                .isInstanceOf(InsufficientTrainingDataException.class);

        IndexStats stats = manager.stats();
        assertThat(stats.trained()).isFalse();
        assertThat(stats.count()).isZero();
    }

    @Test
    @DisplayName("Кластерный индекс: 5 документов при 100 кластерах и политике WARN")
    void shouldFlagDegradedTrainingUnderWarnPolicy() {
        properties.setVariant(IndexVariant.CLUSTERED);
        properties.getClustered().setClusters(100);
        properties.getClustered().setInsufficientTraining(InsufficientTrainingPolicy.WARN);
        IndexManager manager = newManager();

        IndexUpdateReport report = manager.updateIndex(fivePending(), 50);

        assertThat(report.added()).isEqualTo(5);
        assertThat(report.trainingDegraded()).isTrue();
        assertThat(manager.stats().degraded()).isTrue();
        assertThat(keys(manager.findSimilarByVector(new float[]{5f, 5f}, 1))).containsExactly("C");
        assertThat(embeddingGenerator.encodeCalls).isEqualTo(5);
    }

    @Test
    @DisplayName("Немедленная индексация при необученном кластерном индексе откладывается до обновления")
    void shouldLeaveDocumentQueuedWhenClusteredIndexIsUntrained() {
        properties.setVariant(IndexVariant.CLUSTERED);
        properties.getClustered().setClusters(2);
        documentStore.putAbstract("A", "0,0");
        documentStore.putAbstract("B", "5,5");
        IndexManager manager = newManager();
        DocumentService documentService = new DocumentService(documentStore, new AbstractTextSource(), manager);

        assertThat(documentService.indexNow("A")).isFalse();
        assertThat(manager.addDocument("B", "5,5")).isFalse();

        assertThat(manager.stats().count()).isZero();
        assertThat(embeddingGenerator.encodeCalls).isZero();
        assertThat(documentStore.listUnindexed(10)).extracting(DocumentRecord::key).containsExactly("A", "B");

        IndexUpdateReport report = manager.updateIndex(10);

        assertThat(report.added()).isEqualTo(2);
        assertThat(manager.indexedKeys()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    void shouldKeepClusteredIndexTrainedAcrossRestart() {
        properties.setVariant(IndexVariant.CLUSTERED);
        properties.getClustered().setClusters(2);
        properties.getClustered().setProbes(2);
        IndexManager manager = newManager();
        manager.updateIndex(fivePending(), 50);

        IndexManager restored = newManager();

        assertThat(restored.stats().trained()).isTrue();
        assertThat(restored.addDocument("F", "4,4")).isTrue();
        assertThat(keys(restored.findSimilarByVector(new float[]{4f, 4f}, 1))).containsExactly("F");
    }

    @Test
    void shouldBuildGraphIndex() {
        properties.setVariant(IndexVariant.GRAPH);
        IndexManager manager = managerWithAbc();

        assertThat(keys(manager.findSimilarByVector(new float[]{0f, 0f}, 2))).containsExactly("A", "B");
        assertThat(manager.stats().variant()).isEqualTo(IndexVariant.GRAPH);
    }

    private static List<DocumentRef> fivePending() {
        return List.of(
                new DocumentRef("A", "0,0"),
                new DocumentRef("B", "1,0"),
                new DocumentRef("C", "5,5"),
                new DocumentRef("D", "3,1"),
                new DocumentRef("E", "2,7"));
    }
}
