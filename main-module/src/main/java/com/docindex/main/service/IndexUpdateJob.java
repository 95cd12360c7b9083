package com.docindex.main.service;

import com.docindex.common.exception.DocIndexException;
import com.docindex.main.config.IndexProperties;
import com.docindex.main.model.IndexUpdateReport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically indexes documents the store still marks as unindexed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "doc-index.index.update", name = "enabled", havingValue = "true")
public class IndexUpdateJob {

    private final IndexManager indexManager;
    private final IndexProperties indexProperties;

    @Scheduled(
            initialDelayString = "${doc-index.index.update.interval:PT5M}",
            fixedDelayString = "${doc-index.index.update.interval:PT5M}")
    public void run() {
        try {
            IndexUpdateReport report = indexManager.updateIndex(indexProperties.getBatchSize());
            if (report.requested() > 0) {
                log.info("Scheduled index update: {}", report);
            }
        } catch (DocIndexException e) {
            log.error("Scheduled index update failed: {}", e.getMessage(), e);
        }
    }
}
