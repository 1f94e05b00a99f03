package com.delta.siteextract.crawl.discovery;

import com.delta.siteextract.crawl.model.PageType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Table driving page classification: URL path patterns per page type (checked in table order),
 * content cues used when no path pattern matches, and path segments that are never worth
 * crawling.
 */
public final class PageTypeRules {
    private final Map<PageType, List<Pattern>> pathPatterns;
    private final Map<PageType, ContentCues> contentCues;
    private final Set<String> ignoredSegments;

    public PageTypeRules(
        Map<PageType, List<Pattern>> pathPatterns,
        Map<PageType, ContentCues> contentCues,
        Set<String> ignoredSegments
    ) {
        this.pathPatterns = Collections.unmodifiableMap(new LinkedHashMap<>(pathPatterns));
        this.contentCues = Collections.unmodifiableMap(new LinkedHashMap<>(contentCues));
        this.ignoredSegments = ignoredSegments == null ? Set.of() : Set.copyOf(ignoredSegments);
    }

    public Map<PageType, List<Pattern>> pathPatterns() {
        return pathPatterns;
    }

    public Map<PageType, ContentCues> contentCues() {
        return contentCues;
    }

    public Set<String> ignoredSegments() {
        return ignoredSegments;
    }

    public PageType matchPath(String path) {
        String subject = path == null || path.isEmpty() ? "/" : path.toLowerCase(Locale.ROOT);
        for (Map.Entry<PageType, List<Pattern>> entry : pathPatterns.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(subject).find()) {
                    return entry.getKey();
                }
            }
        }
        return null;
    }

    public boolean isIgnoredPath(String path) {
        if (path == null || ignoredSegments.isEmpty()) {
            return false;
        }
        for (String segment : path.toLowerCase(Locale.ROOT).split("/")) {
            if (!segment.isEmpty() && ignoredSegments.contains(segment)) {
                return true;
            }
        }
        return false;
    }

    public record ContentCues(List<String> headings, List<String> classes, List<String> keywords) {
        public ContentCues {
            headings = headings == null ? List.of() : List.copyOf(headings);
            classes = classes == null ? List.of() : List.copyOf(classes);
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
        }
    }

    public static PageTypeRules restaurantDefaults() {
        Map<PageType, List<Pattern>> patterns = new LinkedHashMap<>();
        patterns.put(PageType.MENU, compile(
            "/menus?/?$", "/food/?$", "/dining/?$", "/eat/?$", "/drinks/?$", "/beverages/?$", "/menu/"
        ));
        patterns.put(PageType.CONTACT, compile(
            "/contacts?/?$", "/contact[-_]us/?$", "/reach/?$", "/info/?$", "/information/?$",
            "/locations?/?$", "/find[-_]us/?$", "/visit/?$"
        ));
        patterns.put(PageType.ABOUT, compile(
            "/about/?$", "/about[-_]us/?$", "/story/?$", "/history/?$", "/our[-_]story/?$",
            "/who[-_]we[-_]are/?$", "/background/?$", "/bio/?$"
        ));
        patterns.put(PageType.HOURS, compile(
            "/hours/?$", "/times/?$", "/schedule/?$", "/opening[-_]hours/?$"
        ));
        patterns.put(PageType.HOME, compile(
            "^/?$", "^/index(\\.html?|\\.php)?/?$", "^/home/?$", "^/main/?$"
        ));

        Map<PageType, ContentCues> cues = new LinkedHashMap<>();
        cues.put(PageType.MENU, new ContentCues(
            List.of("menu", "food", "drinks", "appetizers", "entrees", "desserts", "beverages"),
            List.of("menu", "food-menu", "restaurant-menu", "menu-section", "menu-item"),
            List.of("appetizer", "entree", "dessert", "beverage", "wine", "beer")
        ));
        cues.put(PageType.CONTACT, new ContentCues(
            List.of("contact", "reach us", "get in touch", "find us", "location", "address"),
            List.of("contact", "contact-info", "address", "phone", "location"),
            List.of("phone", "address", "email", "directions", "map")
        ));
        cues.put(PageType.ABOUT, new ContentCues(
            List.of("about", "our story", "history", "who we are", "background"),
            List.of("about", "story", "history", "bio", "background"),
            List.of("story", "history", "founded", "family", "tradition", "chef", "owner")
        ));
        cues.put(PageType.HOURS, new ContentCues(
            List.of("hours", "schedule", "operating hours", "opening hours"),
            List.of("hours", "schedule", "operating-hours", "opening-hours"),
            List.of("monday", "tuesday", "wednesday", "thursday", "friday", "saturday", "sunday", "closed")
        ));
        cues.put(PageType.HOME, new ContentCues(
            List.of("welcome", "home"),
            List.of("hero", "welcome", "home"),
            List.of("welcome", "cuisine", "experience")
        ));

        Set<String> ignored = Set.of(
            "blog", "news", "careers", "jobs", "privacy", "terms", "legal", "admin", "login",
            "register", "cart", "checkout", "press", "media", "franchise", "wp-admin", "feed"
        );
        return new PageTypeRules(patterns, cues, ignored);
    }

    private static List<Pattern> compile(String... regexes) {
        return java.util.Arrays.stream(regexes).map(Pattern::compile).toList();
    }
}
