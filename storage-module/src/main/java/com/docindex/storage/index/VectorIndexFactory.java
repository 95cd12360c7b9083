package com.docindex.storage.index;

import com.docindex.storage.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/** Создание пустых индексов и чтение снимков по конфигурации */
@Component
@Slf4j
@RequiredArgsConstructor
public class VectorIndexFactory {

    private final VectorSimilarity vectorSimilarity;

    public VectorIndex create(VectorIndexConfig config) {
        log.info("Creating {} vector index with dimension={}", config.variant(), config.dimension());
        return switch (config.variant()) {
            case EXACT -> new ExactVectorIndex(vectorSimilarity, config.dimension());
            case CLUSTERED -> new ClusteredVectorIndex(
                    vectorSimilarity,
                    trainer(config),
                    config.dimension(),
                    config.clusters(),
                    config.probes(),
                    config.insufficientTrainingPolicy());
            case GRAPH -> new GraphVectorIndex(
                    vectorSimilarity,
                    config.dimension(),
                    config.m(),
                    config.ef(),
                    config.efConstruction(),
                    config.initialCapacity());
        };
    }

    /**
     * Прочитать снимок индекса. Параметры обучения для кластерного варианта
     * берутся из конфигурации, остальное из снимка.
     */
    public VectorIndex read(InputStream in, VectorIndexConfig config) throws IOException {
        return VectorIndexCodec.read(in, vectorSimilarity, trainer(config), config.insufficientTrainingPolicy());
    }

    private KMeansTrainer trainer(VectorIndexConfig config) {
        return new KMeansTrainer(vectorSimilarity, config.trainingIterations(), config.seed());
    }
}
