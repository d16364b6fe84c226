package com.adlanda.documentsearch.service;

import com.adlanda.documentsearch.model.SearchResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Renders search results as a numbered plain-text listing with the source
 * file name and the similarity as a percentage.
 */
@Component
public class SearchResultFormatter {

    static final String NO_RESULTS = "No results found for your search.";

    public String format(List<SearchResult> results) {
        if (results.isEmpty()) {
            return NO_RESULTS;
        }

        StringBuilder text = new StringBuilder();
        text.append("Search Results (").append(results.size()).append(" results):\n");
        text.append("=".repeat(50)).append("\n\n");

        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            text.append(i + 1).append(". Source: ").append(displayName(result.sourceId()))
                    .append(" | Similarity: ")
                    .append(String.format(Locale.ROOT, "%.1f%%", result.score() * 100))
                    .append('\n');
            text.append(result.chunkText()).append("\n\n");
            text.append("-".repeat(30)).append("\n\n");
        }
        return text.toString();
    }

    // stored ids are plain strings and need not be valid paths on this platform
    private static String displayName(String sourceId) {
        int separator = Math.max(sourceId.lastIndexOf('/'), sourceId.lastIndexOf('\\'));
        String fileName = sourceId.substring(separator + 1);
        return fileName.isEmpty() ? sourceId : fileName;
    }
}
