package com.docindex.main.config;

import com.docindex.main.embedding.EmbeddingGenerator;
import com.docindex.storage.index.VectorIndexConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(IndexProperties.class)
public class IndexConfig {

    @Bean
    public VectorIndexConfig vectorIndexConfig(IndexProperties properties, EmbeddingGenerator embeddingGenerator) {
        return toVectorIndexConfig(properties, embeddingGenerator.dimension());
    }

    public static VectorIndexConfig toVectorIndexConfig(IndexProperties properties, int dimension) {
        IndexProperties.Clustered clustered = properties.getClustered();
        IndexProperties.Graph graph = properties.getGraph();
        return VectorIndexConfig.builder()
                .variant(properties.getVariant())
                .dimension(dimension)
                .clusters(clustered.getClusters())
                .probes(clustered.getProbes())
                .trainingIterations(clustered.getTrainingIterations())
                .seed(clustered.getSeed())
                .insufficientTrainingPolicy(clustered.getInsufficientTraining())
                .m(graph.getM())
                .ef(graph.getEf())
                .efConstruction(graph.getEfConstruction())
                .initialCapacity(graph.getInitialCapacity())
                .build();
    }
}
