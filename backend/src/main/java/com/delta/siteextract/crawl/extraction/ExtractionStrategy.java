package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;

import java.util.List;
import java.util.Map;

/**
 * One way of reading schema fields out of a page. Strategies return raw, un-normalized strings
 * keyed by field name; a field the strategy found nothing for is simply missing from the map.
 */
public interface ExtractionStrategy {

    String name();

    /** Confidence attached to every value this strategy yields, before the completeness bonus. */
    double baseConfidence();

    Map<String, List<String>> extract(PageContent page, FieldSchema schema);
}
