package com.adlanda.documentsearch;

import com.adlanda.documentsearch.config.DocumentSearchProperties;
import com.adlanda.documentsearch.exception.DocumentSearchException;
import com.adlanda.documentsearch.health.IndexingHealthIndicator;
import com.adlanda.documentsearch.model.FolderIndexingSummary;
import com.adlanda.documentsearch.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Indexes the configured docs folder on application startup.
 *
 * Disabled by default; enable with docsearch.indexing.enabled=true.
 */
@Component
@Order(1) // Run before StartupInfoLogger
public class StartupIndexingRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupIndexingRunner.class);

    private final IndexingService indexingService;
    private final IndexingHealthIndicator healthIndicator;
    private final DocumentSearchProperties properties;

    public StartupIndexingRunner(IndexingService indexingService,
                                 IndexingHealthIndicator healthIndicator,
                                 DocumentSearchProperties properties) {
        this.indexingService = indexingService;
        this.healthIndicator = healthIndicator;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getIndexing().isEnabled()) {
            log.info("Startup indexing disabled");
            return;
        }

        Path docsPath = Path.of(properties.getIndexing().getDocsPath());
        log.info("Starting document indexing from {}...", docsPath);

        try {
            FolderIndexingSummary summary = indexingService.indexFolder(docsPath);
            if (summary.documentsFound() == 0) {
                log.warn("No documents found to index");
            }
            healthIndicator.markHealthy(summary);
        } catch (DocumentSearchException e) {
            log.error("Failed to index documents: {}", e.getMessage(), e);
            healthIndicator.markUnhealthy(e.getMessage());
        }
    }
}
