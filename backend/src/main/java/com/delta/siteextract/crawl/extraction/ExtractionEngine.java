package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldSpec;
import com.delta.siteextract.crawl.model.FieldValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs the extraction strategies in descending confidence order. A field is settled by the
 * first strategy that yields a usable value for it; later strategies only fill the gaps.
 * Values are normalized here, before they leave the engine.
 */
@Service
public class ExtractionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExtractionEngine.class);

    private final List<ExtractionStrategy> strategies;

    public ExtractionEngine(List<ExtractionStrategy> strategies) {
        List<ExtractionStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparingDouble(ExtractionStrategy::baseConfidence).reversed());
        this.strategies = List.copyOf(ordered);
    }

    public List<ExtractionStrategy> strategies() {
        return strategies;
    }

    public Map<String, List<FieldValue>> extract(PageContent page, FieldSchema schema) {
        Map<String, FieldValue> resolved = new LinkedHashMap<>();
        Set<String> pending = new HashSet<>(schema.fieldNames());
        for (ExtractionStrategy strategy : strategies) {
            if (pending.isEmpty()) {
                break;
            }
            Map<String, List<String>> raw;
            try {
                raw = strategy.extract(page, schema);
            } catch (ExtractionException e) {
                log.debug("extraction degraded url={} strategy={} reason={}", page.url(), strategy.name(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                log.warn("extraction strategy failed url={} strategy={} error={}", page.url(), strategy.name(), e.toString());
                continue;
            }
            if (raw == null || raw.isEmpty()) {
                continue;
            }
            for (FieldSpec field : schema.fields()) {
                if (!pending.contains(field.name())) {
                    continue;
                }
                FieldValue value = toFieldValue(field, raw.get(field.name()), strategy, page.url());
                if (value != null) {
                    resolved.put(field.name(), value);
                    pending.remove(field.name());
                }
            }
        }

        Map<String, List<FieldValue>> out = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            FieldValue value = resolved.get(field.name());
            if (value != null) {
                out.put(field.name(), List.of(value));
            }
        }
        return out;
    }

    private FieldValue toFieldValue(FieldSpec field, List<String> raw, ExtractionStrategy strategy, String sourceUrl) {
        if (raw == null || raw.isEmpty()) {
            return null;
        }
        List<String> values;
        if (field.listValued()) {
            values = FieldNormalizer.normalizeList(field.format(), raw);
        } else {
            values = List.of();
            for (String candidate : raw) {
                String normalized = FieldNormalizer.normalize(field.format(), candidate);
                if (normalized != null) {
                    values = List.of(normalized);
                    break;
                }
            }
        }
        if (values.isEmpty()) {
            return null;
        }
        double confidence = strategy.baseConfidence() + FieldNormalizer.completenessBonus(field.format(), values);
        return new FieldValue(values, field.listValued(), confidence, sourceUrl, strategy.name());
    }
}
