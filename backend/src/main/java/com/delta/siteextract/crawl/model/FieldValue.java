package com.delta.siteextract.crawl.model;

import java.util.List;

/**
 * A single extracted datum. Scalar fields carry exactly one entry in {@code values}; list fields
 * carry one entry per item.
 */
public record FieldValue(
    List<String> values,
    boolean listValued,
    double confidence,
    String sourceUrl,
    String strategy
) {
    public FieldValue {
        values = values == null ? List.of() : List.copyOf(values);
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }

    public static FieldValue single(String value, double confidence, String sourceUrl, String strategy) {
        return new FieldValue(List.of(value), false, confidence, sourceUrl, strategy);
    }

    public static FieldValue list(List<String> items, double confidence, String sourceUrl, String strategy) {
        return new FieldValue(items, true, confidence, sourceUrl, strategy);
    }

    public String text() {
        if (values.isEmpty()) {
            return null;
        }
        return listValued ? String.join(", ", values) : values.get(0);
    }

    public int contentLength() {
        int total = 0;
        for (String value : values) {
            total += value == null ? 0 : value.length();
        }
        return total;
    }

    public boolean isEmpty() {
        return values.stream().allMatch(value -> value == null || value.isBlank());
    }
}
