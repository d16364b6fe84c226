package com.adlanda.documentsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Document Search - Main Application
 *
 * Indexes documents as paragraph-level embedding vectors and retrieves the
 * chunks most similar to a free-text query.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via an OpenAI-compatible API
 * - PostgreSQL (REAL[] columns plus SQL scoring functions) for vector storage
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class DocumentSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(DocumentSearchApplication.class, args);
    }
}
