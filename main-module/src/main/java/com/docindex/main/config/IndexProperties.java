package com.docindex.main.config;

import com.docindex.storage.index.IndexVariant;
import com.docindex.storage.index.InsufficientTrainingPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration of the vector index, its persistence and the update pipeline.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "doc-index.index")
public class IndexProperties {

    /**
     * Directory holding vectors.idx and id-map.bin.
     */
    @NotBlank
    private String directory = "./data/index";

    @NotNull
    private IndexVariant variant = IndexVariant.EXACT;

    @NotNull
    private LoadFailurePolicy loadFailure = LoadFailurePolicy.FRESH;

    /**
     * Maximum number of pending texts encoded to train a clustered index.
     */
    @Min(1)
    private int trainingSampleSize = 100;

    /**
     * A snapshot is written after this many successful additions during an update.
     */
    @Min(1)
    private int checkpointInterval = 10;

    @Min(1)
    private int batchSize = 50;

    @Valid
    @NotNull
    private Clustered clustered = new Clustered();

    @Valid
    @NotNull
    private Graph graph = new Graph();

    @Valid
    @NotNull
    private Update update = new Update();

    @Data
    public static class Clustered {
        @Min(1)
        private int clusters = 100;
        @Min(1)
        private int probes = 10;
        @Min(1)
        private int trainingIterations = 25;
        private long seed = 42L;
        @NotNull
        private InsufficientTrainingPolicy insufficientTraining = InsufficientTrainingPolicy.WARN;
    }

    @Data
    public static class Graph {
        @Min(2)
        private int m = 16;
        @Min(1)
        private int ef = 100;
        @Min(1)
        private int efConstruction = 200;
        @Min(1)
        private int initialCapacity = 1024;
    }

    @Data
    public static class Update {
        /**
         * Periodically drain unindexed documents from the store.
         */
        private boolean enabled = false;
        @NotNull
        private Duration interval = Duration.ofMinutes(5);
    }
}
