package com.delta.siteextract.crawl.model;

/**
 * Shape of a field's value. Drives heuristic matching and normalization.
 */
public enum FieldFormat {
    TEXT,
    NAME,
    PHONE,
    ADDRESS,
    HOURS,
    PRICE_RANGE,
    EMAIL,
    MENU_ITEMS,
    LINKS
}
