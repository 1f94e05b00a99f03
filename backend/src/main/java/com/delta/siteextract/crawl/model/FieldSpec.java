package com.delta.siteextract.crawl.model;

import java.util.List;

/**
 * One field of a {@link FieldSchema}.
 *
 * @param name             field name used in extracted maps and entity records
 * @param required         whether the entity is considered incomplete without it
 * @param importanceWeight weight in the overall record confidence
 * @param listValued       whether values from several pages are unioned rather than resolved
 * @param format           value shape used for heuristics and normalization
 * @param propertyNames    structured-data / microdata property names that carry the field
 * @param labels           visible-text labels that introduce the field ("Phone", "Tel")
 */
public record FieldSpec(
    String name,
    boolean required,
    double importanceWeight,
    boolean listValued,
    FieldFormat format,
    List<String> propertyNames,
    List<String> labels
) {
    public FieldSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        if (importanceWeight < 0) {
            throw new IllegalArgumentException("importance weight must not be negative: " + name);
        }
        format = format == null ? FieldFormat.TEXT : format;
        propertyNames = propertyNames == null ? List.of() : List.copyOf(propertyNames);
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static FieldSpec required(String name, double weight, FieldFormat format, List<String> propertyNames, List<String> labels) {
        return new FieldSpec(name, true, weight, false, format, propertyNames, labels);
    }

    public static FieldSpec optional(String name, double weight, FieldFormat format, List<String> propertyNames, List<String> labels) {
        return new FieldSpec(name, false, weight, false, format, propertyNames, labels);
    }

    public static FieldSpec list(String name, double weight, FieldFormat format, List<String> propertyNames, List<String> labels) {
        return new FieldSpec(name, false, weight, true, format, propertyNames, labels);
    }
}
