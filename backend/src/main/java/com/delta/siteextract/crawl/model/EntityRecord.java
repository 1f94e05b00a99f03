package com.delta.siteextract.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final merged output for one site. Fields are keyed by schema name in schema order; required
 * fields that no page produced are listed in {@code absentFields} instead.
 */
public record EntityRecord(
    String siteUrl,
    Map<String, ResolvedField> fields,
    List<String> absentFields,
    double confidence,
    List<FieldConflict> unresolvedConflicts
) {
    public EntityRecord {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        absentFields = absentFields == null ? List.of() : List.copyOf(absentFields);
        unresolvedConflicts = unresolvedConflicts == null ? List.of() : List.copyOf(unresolvedConflicts);
    }

    public String value(String fieldName) {
        ResolvedField field = fields.get(fieldName);
        return field == null ? null : field.value();
    }

    public List<String> values(String fieldName) {
        ResolvedField field = fields.get(fieldName);
        return field == null ? List.of() : field.values();
    }

    public List<String> contributingUrls(String fieldName) {
        ResolvedField field = fields.get(fieldName);
        return field == null ? List.of() : field.contributingUrls();
    }

    public boolean isAbsent(String fieldName) {
        return absentFields.contains(fieldName);
    }
}
