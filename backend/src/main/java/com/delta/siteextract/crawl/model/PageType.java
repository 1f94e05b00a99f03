package com.delta.siteextract.crawl.model;

import java.util.Locale;

public enum PageType {
    HOME,
    MENU,
    CONTACT,
    ABOUT,
    HOURS,
    OTHER;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static PageType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        try {
            return PageType.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ignored) {
            return OTHER;
        }
    }
}
