package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.exception.DocumentProcessingException;
import com.adlanda.documentsearch.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.document.Document;
import org.springframework.ai.reader.pdf.PagePdfDocumentReader;
import org.springframework.ai.reader.tika.TikaDocumentReader;
import org.springframework.core.io.FileSystemResource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Extracts plain text from PDF, DOCX, text and markdown files.
 *
 * PDF pages are read with Spring AI's page reader and concatenated; DOCX
 * files go through Tika and come back with one blank line between non-empty
 * paragraphs. Runs of blank lines in PDF and text content are normalised to
 * a single blank line so paragraph chunking sees consistent breaks.
 */
@Service
public class PlainTextExtractor implements TextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PlainTextExtractor.class);

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".pdf", ".docx", ".txt", ".md");

    private static final Pattern BLANK_LINE_RUN = Pattern.compile("(\\R\\s*){2,}");

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    @Override
    public boolean supports(Path file) {
        return SUPPORTED_EXTENSIONS.contains(extensionOf(file));
    }

    @Override
    public String extract(Path file) {
        log.info("Processing file: {}", file);

        String extension = extensionOf(file);
        log.info("File type: {}", extension);
        if (!supports(file)) {
            log.error("Unsupported file format: {}", extension);
            throw new ValidationException("Unsupported file format: " + extension
                    + ". Only " + String.join(", ", new TreeSet<>(SUPPORTED_EXTENSIONS)) + " are supported.");
        }
        if (!Files.isRegularFile(file)) {
            log.error("File not found: {}", file);
            throw new DocumentProcessingException("File not found: " + file);
        }

        String content;
        try {
            content = switch (extension) {
                case ".pdf" -> normalizeBreaks(readPdf(file));
                case ".docx" -> readDocx(file);
                default -> normalizeBreaks(Files.readString(file, StandardCharsets.UTF_8));
            };
        } catch (IOException | RuntimeException e) {
            log.error("Failed to process file {}: {}", file, e.getMessage());
            throw new DocumentProcessingException("Failed to process file " + file + ": " + e.getMessage(), e);
        }

        if (content.isBlank()) {
            log.error("File is empty: {}", file);
            throw new ValidationException("File is empty: " + file);
        }

        log.info("Text length: {} characters", content.length());
        return content;
    }

    private String readPdf(Path file) {
        List<Document> pages = new PagePdfDocumentReader(new FileSystemResource(file)).get();
        return pages.stream()
                .map(Document::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining());
    }

    private String readDocx(Path file) {
        String text = new TikaDocumentReader(new FileSystemResource(file)).get().stream()
                .map(Document::getText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining("\n"));
        // Tika ends every paragraph with a line break
        return LINE_BREAK.splitAsStream(text)
                .filter(paragraph -> !paragraph.isBlank())
                .collect(Collectors.joining("\n\n"));
    }

    private String normalizeBreaks(String text) {
        return BLANK_LINE_RUN.matcher(text).replaceAll("\n\n");
    }

    private static String extensionOf(Path file) {
        String name = file.getFileName() != null ? file.getFileName().toString() : "";
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot).toLowerCase(Locale.ROOT) : "";
    }
}
