package com.adlanda.documentsearch;

import com.adlanda.documentsearch.exception.DocumentSearchException;
import com.adlanda.documentsearch.store.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after StartupIndexingRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final VectorStore vectorStore;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(VectorStore vectorStore) {
        this.vectorStore = vectorStore;
    }

    @Override
    public void run(ApplicationArguments args) {
        String indexSize;
        try {
            indexSize = vectorStore.count() + " chunks";
        } catch (DocumentSearchException e) {
            log.warn("Could not read index size: {}", e.getMessage());
            indexSize = "unavailable";
        }

        log.info("""

            Document Search v{}
            Index: {}

            API Endpoints:
              GET    http://localhost:{}/api/v1
              POST   http://localhost:{}/api/v1/query
              POST   http://localhost:{}/api/v1/documents
              GET    http://localhost:{}/api/v1/sources
              DELETE http://localhost:{}/api/v1/sources?sourceId=...

            Health:
              GET    http://localhost:{}/actuator/health
            """,
            version, indexSize, port, port, port, port, port, port
        );
    }
}
