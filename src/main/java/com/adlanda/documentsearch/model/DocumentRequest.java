package com.adlanda.documentsearch.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Request body for the indexing endpoints. The path names a document or a folder.
 */
public record DocumentRequest(
        @NotBlank(message = "Path is required")
        String path
) {}
