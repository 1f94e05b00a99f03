package com.delta.siteextract.crawl.model;

import java.util.List;

/**
 * Candidates for one field that no tie-break could separate. {@code chosenValue} is the
 * first-seen candidate, used as the best-effort default.
 */
public record FieldConflict(String fieldName, String chosenValue, List<Candidate> candidates) {
    public FieldConflict {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public record Candidate(String value, double confidence, String sourceUrl, PageType pageType) {
    }
}
