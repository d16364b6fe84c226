package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.exception.DocumentProcessingException;
import com.adlanda.documentsearch.exception.ValidationException;

import java.nio.file.Path;

/**
 * Pulls raw, paragraph-separable text out of a document file.
 */
public interface TextExtractor {

    /**
     * @return true if this extractor can read the file's format
     */
    boolean supports(Path file);

    /**
     * @throws ValidationException if the format is unsupported or the document holds no text
     * @throws DocumentProcessingException if the file is missing or cannot be read
     */
    String extract(Path file);
}
