package com.delta.siteextract.crawl.model;

import java.util.List;

public record ResolvedField(
    String name,
    List<String> values,
    boolean listValued,
    double confidence,
    List<String> contributingUrls,
    ResolutionRule rule
) {
    public ResolvedField {
        values = values == null ? List.of() : List.copyOf(values);
        contributingUrls = contributingUrls == null ? List.of() : List.copyOf(contributingUrls);
    }

    public String value() {
        if (values.isEmpty()) {
            return null;
        }
        return listValued ? String.join(", ", values) : values.get(0);
    }
}
