package com.adlanda.documentsearch.search;

import com.adlanda.documentsearch.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Interleaves several ranked result lists into one.
 *
 * Round r takes the r-th entry of every list in turn until {@code topK}
 * results are collected. A chunk text seen before is not added again; the
 * earlier entry is replaced in place when the newcomer scores higher. The
 * outcome is a fair share across query vectors, not a global top-k by score.
 */
final class RoundRobinMerger {

    private static final Logger log = LoggerFactory.getLogger(RoundRobinMerger.class);

    private RoundRobinMerger() {
    }

    static List<SearchResult> merge(List<List<SearchResult>> rankedLists, int topK) {
        List<SearchResult> merged = new ArrayList<>();
        Map<String, Integer> positionByText = new HashMap<>();

        for (int round = 0; round < topK && merged.size() < topK; round++) {
            for (List<SearchResult> ranked : rankedLists) {
                if (merged.size() >= topK) {
                    break;
                }
                if (round >= ranked.size()) {
                    continue;
                }

                SearchResult candidate = ranked.get(round);
                Integer existing = positionByText.get(candidate.chunkText());
                if (existing != null) {
                    if (candidate.score() > merged.get(existing).score()) {
                        merged.set(existing, candidate);
                    }
                    continue;
                }

                positionByText.put(candidate.chunkText(), merged.size());
                merged.add(candidate);
            }
        }

        log.info("Merged {} unique results from {} searches", merged.size(), rankedLists.size());
        return merged;
    }
}
