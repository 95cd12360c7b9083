package com.docindex.main.config;

import com.docindex.main.embedding.EmbeddingGenerator;
import com.docindex.main.embedding.HashingEmbeddingGenerator;
import com.docindex.main.embedding.OnnxEmbeddingGenerator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Slf4j
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingConfig {

    @Bean
    public EmbeddingGenerator embeddingGenerator(EmbeddingProperties properties) {
        log.info("Using {} embedding provider", properties.getProvider());
        return switch (properties.getProvider()) {
            case HASHING -> new HashingEmbeddingGenerator(properties.getDimension());
            case ONNX -> new OnnxEmbeddingGenerator(
                    Path.of(properties.getModelDirectory()),
                    properties.getMaxTokens(),
                    properties.getIntraOpThreads());
        };
    }
}
