package com.delta.siteextract.crawl.aggregate;

import com.delta.siteextract.crawl.model.PageType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * For each field, the page types whose values are trusted most, best first. Page types not
 * listed for a field carry no authority for it.
 */
public final class PageAuthorityTable {
    public static final int NO_AUTHORITY = Integer.MAX_VALUE;

    private final Map<String, List<PageType>> authorities;

    public PageAuthorityTable(Map<String, List<PageType>> authorities) {
        Map<String, List<PageType>> copy = new LinkedHashMap<>();
        authorities.forEach((field, types) -> copy.put(field, List.copyOf(types)));
        this.authorities = Collections.unmodifiableMap(copy);
    }

    /** Lower is more authoritative; {@link #NO_AUTHORITY} when the page type is not listed. */
    public int rank(String fieldName, PageType pageType) {
        List<PageType> types = authorities.get(fieldName);
        if (types == null || pageType == null) {
            return NO_AUTHORITY;
        }
        int index = types.indexOf(pageType);
        return index < 0 ? NO_AUTHORITY : index;
    }

    public Map<String, List<PageType>> authorities() {
        return authorities;
    }

    public static PageAuthorityTable restaurantDefaults() {
        Map<String, List<PageType>> table = new LinkedHashMap<>();
        table.put("phone", List.of(PageType.CONTACT, PageType.HOURS));
        table.put("email", List.of(PageType.CONTACT, PageType.HOURS));
        table.put("hours", List.of(PageType.CONTACT, PageType.HOURS));
        table.put("menu_items", List.of(PageType.MENU));
        table.put("price_range", List.of(PageType.MENU));
        table.put("name", List.of(PageType.HOME, PageType.ABOUT));
        table.put("address", List.of(PageType.HOME, PageType.ABOUT));
        table.put("description", List.of(PageType.HOME, PageType.ABOUT));
        table.put("cuisine", List.of(PageType.HOME, PageType.ABOUT));
        return new PageAuthorityTable(table);
    }
}
