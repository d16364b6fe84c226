package com.adlanda.documentsearch.chunking;

import com.adlanda.documentsearch.exception.InvalidInputException;
import com.adlanda.documentsearch.model.Chunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits text into paragraph chunks.
 *
 * A paragraph break is one or more blank lines; lines holding only whitespace
 * count as blank, so uneven spacing left by format conversion does not create
 * extra chunks. Used for both documents and queries.
 */
@Component
public class ParagraphChunker {

    private static final Logger log = LoggerFactory.getLogger(ParagraphChunker.class);

    public static final String STRATEGY = "paragraph";

    // a line break followed by one or more blank (or whitespace-only) lines
    private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\R(?:\\h*\\R)+");

    /**
     * Splits text into trimmed, non-empty paragraphs in source order.
     *
     * @param text Raw text to split
     * @return Paragraph chunks, first paragraph first
     * @throws InvalidInputException if the text is null, empty or whitespace only
     */
    public List<String> chunk(String text) {
        if (text == null || text.isBlank()) {
            log.error("Text is empty");
            throw new InvalidInputException("Cannot chunk empty text");
        }

        List<String> chunks = new ArrayList<>();
        for (String paragraph : PARAGRAPH_BREAK.split(text)) {
            String trimmed = paragraph.strip();
            if (!trimmed.isEmpty()) {
                chunks.add(trimmed);
            }
        }

        log.info("Split into {} paragraphs", chunks.size());
        return chunks;
    }

    /**
     * Splits a document's text into chunks tagged with its source identifier.
     */
    public List<Chunk> chunkDocument(String sourceId, String text) {
        return chunk(text).stream()
                .map(paragraph -> new Chunk(sourceId, paragraph, STRATEGY))
                .toList();
    }
}
