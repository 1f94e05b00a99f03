package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldSpec;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern and DOM-convention matching over visible text. Runs last and fills whatever the
 * markup-based strategies left empty.
 */
@Component
public class HeuristicStrategy implements ExtractionStrategy {
    public static final String NAME = "heuristic";

    private static final Pattern PHONE_PATTERN = Pattern.compile(
        "(?<![\\d])(?:\\+?1[\\s.-]?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]?\\d{4}(?![\\d])"
    );
    private static final Pattern SHORT_PHONE_PATTERN = Pattern.compile("(?<![\\d])\\d{3}[\\s.-]\\d{4}(?![\\d])");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("[\\w.+-]+@[\\w-]+(?:\\.[\\w-]+)*\\.[A-Za-z]{2,}");
    private static final Pattern ADDRESS_PATTERN = Pattern.compile(
        "\\d{1,6}\\s+(?:[A-Za-z0-9.'-]+\\s+){0,5}?"
            + "(?:Street|St|Avenue|Ave|Road|Rd|Boulevard|Blvd|Drive|Dr|Lane|Ln|Way|Place|Pl|Court|Ct|Highway|Hwy|Parkway|Pkwy|Square|Sq)\\.?"
            + "(?:,?\\s+(?:Suite|Ste|Unit|#)\\s*[\\w-]+)?"
            + "(?:,\\s*[A-Za-z .'-]+,?\\s*[A-Z]{2}\\s*\\d{5}(?:-\\d{4})?)?"
    );
    private static final Pattern HOURS_PATTERN = Pattern.compile(
        "(?i)(?:mon(?:day)?|tue(?:s(?:day)?)?|wed(?:nesday)?|thu(?:r(?:s(?:day)?)?)?|fri(?:day)?|sat(?:urday)?|sun(?:day)?|daily|every day)"
            + "[^.!\\n]{0,40}?\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)?\\s*(?:-|\u2013|to)\\s*\\d{1,2}(?::\\d{2})?\\s*(?:am|pm)?"
    );
    private static final Pattern PRICE_RANGE_PATTERN = Pattern.compile(
        "\\$\\d{1,3}\\s*(?:-|\u2013|to)\\s*\\$?\\d{1,3}"
    );
    private static final Pattern DOLLAR_TIER_PATTERN = Pattern.compile("(?<![\\w$])\\${1,4}(?![\\w$])");
    private static final Pattern TITLE_SEPARATOR = Pattern.compile("\\s+[|\u2013\u2014-]\\s+|\\s*\\|\\s*|:\\s+");
    private static final Pattern MENU_ITEM_SPLIT = Pattern.compile("\\s*(?:[\u2013\u2014]|\\s-\\s|\\$|\\.{3,}).*$");

    private static final Set<String> GENERIC_TITLES = Set.of(
        "home", "homepage", "welcome", "menu", "menus", "our menu", "food menu", "contact", "contact us",
        "about", "about us", "our story", "hours", "location", "locations", "find us", "gallery",
        "reservations", "order online", "index"
    );
    private static final List<String> MENU_SECTION_HEADINGS = List.of(
        "appetizers", "starters", "entrees", "entr\u00e9es", "mains", "main courses", "desserts", "beverages",
        "drinks", "salads", "soups", "sides", "pasta", "pizza", "sandwiches", "specials"
    );
    private static final List<String> MENU_ITEM_SELECTORS = List.of(
        ".menu-item-name", ".menu-item-title", ".dish-name", ".item-name"
    );
    private static final List<String> SOCIAL_HOSTS = List.of(
        "facebook.com", "instagram.com", "twitter.com", "x.com", "yelp.com", "tiktok.com", "tripadvisor.com"
    );
    private static final List<String> CUISINES = List.of(
        "italian", "mexican", "chinese", "japanese", "thai", "indian", "french", "american", "mediterranean",
        "greek", "korean", "vietnamese", "spanish", "middle eastern", "seafood", "steakhouse", "barbecue",
        "sushi", "pizza", "vegan", "vegetarian"
    );
    private static final int MAX_MENU_ITEMS = 200;
    private static final int MAX_LABELLED_VALUE = 200;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double baseConfidence() {
        return 0.4;
    }

    @Override
    public Map<String, List<String>> extract(PageContent page, FieldSchema schema) {
        Document document = page.document();
        if (document.body() == null) {
            return Map.of();
        }
        String text = page.visibleText();
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            List<String> values = switch (field.format()) {
                case NAME -> single(name(document));
                case PHONE -> single(phone(document, text, field));
                case EMAIL -> single(email(document, text, field));
                case ADDRESS -> single(address(document, text, field));
                case HOURS -> single(hours(document, text, field));
                case PRICE_RANGE -> single(priceRange(document, text, field));
                case MENU_ITEMS -> menuItems(document);
                case LINKS -> socialLinks(document);
                case TEXT -> single(freeText(document, text, field));
            };
            if (!values.isEmpty()) {
                out.put(field.name(), values);
            }
        }
        return out;
    }

    String name(Document document) {
        String siteName = metaContent(document, "meta[property=og:site_name]");
        if (siteName != null && !isGeneric(siteName)) {
            return siteName;
        }
        String fromOgTitle = cleanTitle(metaContent(document, "meta[property=og:title]"));
        if (fromOgTitle != null) {
            return fromOgTitle;
        }
        String fromTitle = cleanTitle(document.title());
        if (fromTitle != null) {
            return fromTitle;
        }
        for (Element heading : document.select("h1")) {
            String candidate = heading.text().trim();
            if (!candidate.isEmpty() && candidate.length() <= 80 && !isGeneric(candidate)) {
                return candidate;
            }
        }
        for (Element branded : document.select(".restaurant-name, .site-title, .brand, .logo-text, .navbar-brand")) {
            String candidate = branded.text().trim();
            if (!candidate.isEmpty() && candidate.length() <= 80 && !isGeneric(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private String cleanTitle(String title) {
        if (title == null || title.isBlank()) {
            return null;
        }
        for (String segment : TITLE_SEPARATOR.split(title.trim())) {
            String candidate = segment.trim();
            if (!candidate.isEmpty() && candidate.length() <= 80 && !isGeneric(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private boolean isGeneric(String candidate) {
        return GENERIC_TITLES.contains(candidate.trim().toLowerCase(Locale.ROOT));
    }

    private String phone(Document document, String text, FieldSpec field) {
        for (Element link : document.select("a[href^=tel:]")) {
            String number = link.attr("href").substring("tel:".length()).trim();
            if (!number.isEmpty()) {
                return number;
            }
        }
        String labelled = labelledValue(document, field.labels());
        if (labelled != null) {
            Matcher full = PHONE_PATTERN.matcher(labelled);
            if (full.find()) {
                return full.group();
            }
            Matcher local = SHORT_PHONE_PATTERN.matcher(labelled);
            if (local.find()) {
                return local.group();
            }
        }
        Matcher matcher = PHONE_PATTERN.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    private String email(Document document, String text, FieldSpec field) {
        for (Element link : document.select("a[href^=mailto:]")) {
            String address = link.attr("href").substring("mailto:".length()).trim();
            if (!address.isEmpty()) {
                return address;
            }
        }
        String labelled = labelledValue(document, field.labels());
        Matcher matcher = EMAIL_PATTERN.matcher(labelled != null ? labelled : text);
        if (matcher.find()) {
            return matcher.group();
        }
        return null;
    }

    private String address(Document document, String text, FieldSpec field) {
        for (Element element : document.select("address, .address, .street-address, .adr, .location-address")) {
            String candidate = element.text().trim();
            Matcher matcher = ADDRESS_PATTERN.matcher(candidate);
            if (matcher.find()) {
                return matcher.group();
            }
            if (!candidate.isEmpty() && candidate.length() <= MAX_LABELLED_VALUE && candidate.matches("^\\d+\\s+.*")) {
                return candidate;
            }
        }
        String labelled = labelledValue(document, field.labels());
        if (labelled != null) {
            Matcher matcher = ADDRESS_PATTERN.matcher(labelled);
            if (matcher.find()) {
                return matcher.group();
            }
            if (labelled.matches("^\\d+\\s+\\S.*")) {
                return labelled;
            }
        }
        Matcher matcher = ADDRESS_PATTERN.matcher(text);
        return matcher.find() ? matcher.group() : null;
    }

    private String hours(Document document, String text, FieldSpec field) {
        String labelled = labelledValue(document, field.labels());
        if (labelled != null && HOURS_PATTERN.matcher(labelled).find()) {
            return labelled;
        }
        for (Element element : document.select("[class*=hour], [id*=hour], [class*=opening]")) {
            String candidate = element.text().trim();
            if (!candidate.isEmpty() && candidate.length() <= MAX_LABELLED_VALUE && HOURS_PATTERN.matcher(candidate).find()) {
                return candidate;
            }
        }
        List<String> spans = new ArrayList<>();
        Matcher matcher = HOURS_PATTERN.matcher(text);
        while (matcher.find() && spans.size() < 7) {
            spans.add(matcher.group().trim());
        }
        return spans.isEmpty() ? null : String.join("; ", spans);
    }

    private String priceRange(Document document, String text, FieldSpec field) {
        String labelled = labelledValue(document, field.labels());
        if (labelled != null) {
            Matcher tier = DOLLAR_TIER_PATTERN.matcher(labelled);
            if (tier.find()) {
                return tier.group();
            }
            Matcher range = PRICE_RANGE_PATTERN.matcher(labelled);
            if (range.find()) {
                return range.group();
            }
        }
        for (Element element : document.select(".price-range, .pricerange, [class*=price-range]")) {
            String candidate = element.text().trim();
            if (!candidate.isEmpty() && candidate.length() <= 20) {
                return candidate;
            }
        }
        Matcher range = PRICE_RANGE_PATTERN.matcher(text);
        return range.find() ? range.group() : null;
    }

    private List<String> menuItems(Document document) {
        Set<String> items = new LinkedHashSet<>();
        for (String selector : MENU_ITEM_SELECTORS) {
            for (Element element : document.select(selector)) {
                if (isNavigation(element)) {
                    continue;
                }
                addMenuItem(items, element.text());
            }
        }
        if (items.isEmpty()) {
            for (Element element : document.select(".menu-item, .food-item, .dish")) {
                if (isNavigation(element)) {
                    continue;
                }
                Element named = element.selectFirst("h3, h4, h5, .name, .title, strong");
                addMenuItem(items, named != null ? named.text() : element.text());
            }
        }
        if (items.isEmpty()) {
            for (Element heading : document.select("h2, h3, h4")) {
                String headingText = heading.text().trim().toLowerCase(Locale.ROOT);
                if (!MENU_SECTION_HEADINGS.contains(headingText)) {
                    continue;
                }
                Element sibling = heading.nextElementSibling();
                while (sibling != null && !sibling.is("h1, h2, h3, h4") && items.size() < MAX_MENU_ITEMS) {
                    if (sibling.is("ul, ol")) {
                        for (Element li : sibling.select("> li")) {
                            addMenuItem(items, li.text());
                        }
                    } else if (sibling.is("p")) {
                        addMenuItem(items, sibling.text());
                    }
                    sibling = sibling.nextElementSibling();
                }
            }
        }
        return new ArrayList<>(items);
    }

    // Site navigation (WordPress li.menu-item, header and footer links) is not a food menu.
    private boolean isNavigation(Element element) {
        String className = element.className();
        return className.contains("menu-item-type") || className.contains("menu-item-object")
            || element.parents().is("nav, header, footer");
    }

    private void addMenuItem(Set<String> items, String raw) {
        if (raw == null || items.size() >= MAX_MENU_ITEMS) {
            return;
        }
        String name = MENU_ITEM_SPLIT.matcher(raw.trim()).replaceAll("").trim();
        if (!name.isEmpty() && name.length() <= 100) {
            items.add(name);
        }
    }

    private List<String> socialLinks(Document document) {
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.attr("abs:href");
            if (href.isBlank()) {
                href = anchor.attr("href");
            }
            String lower = href.toLowerCase(Locale.ROOT);
            for (String host : SOCIAL_HOSTS) {
                if (lower.contains("://" + host) || lower.contains("://www." + host)) {
                    links.add(href);
                    break;
                }
            }
        }
        return new ArrayList<>(links);
    }

    private String freeText(Document document, String text, FieldSpec field) {
        String labelled = labelledValue(document, field.labels());
        if (labelled != null) {
            return labelled;
        }
        if (field.propertyNames().contains("description")) {
            String description = metaContent(document, "meta[name=description]");
            return description != null ? description : metaContent(document, "meta[property=og:description]");
        }
        if (field.propertyNames().contains("servesCuisine")) {
            String lower = text.toLowerCase(Locale.ROOT);
            List<String> found = new ArrayList<>();
            for (String cuisine : CUISINES) {
                if (found.size() < 3 && Pattern.compile("\\b" + Pattern.quote(cuisine) + "\\b").matcher(lower).find()) {
                    found.add(titleCase(cuisine));
                }
            }
            return found.isEmpty() ? null : String.join(", ", found);
        }
        return null;
    }

    /**
     * Finds the innermost element whose text reads "{label}: value" and returns the value.
     */
    String labelledValue(Document document, List<String> labels) {
        if (labels.isEmpty()) {
            return null;
        }
        Pattern labelled = labelPattern(labels);
        for (Element element : document.body().select("*")) {
            String own = element.text().trim();
            if (own.isEmpty() || own.length() > MAX_LABELLED_VALUE * 2) {
                continue;
            }
            Matcher matcher = labelled.matcher(own);
            if (!matcher.find()) {
                continue;
            }
            boolean childMatches = false;
            for (Element child : element.children()) {
                Matcher childMatcher = labelled.matcher(child.text().trim());
                if (childMatcher.find() && !childMatcher.group(1).isBlank()) {
                    childMatches = true;
                    break;
                }
            }
            if (childMatches) {
                continue;
            }
            String value = matcher.group(1).trim();
            if (!value.isEmpty()) {
                return value.length() > MAX_LABELLED_VALUE ? value.substring(0, MAX_LABELLED_VALUE) : value;
            }
            Element next = element.nextElementSibling();
            if (next != null && !next.text().isBlank()) {
                return next.text().trim();
            }
        }
        return null;
    }

    private Pattern labelPattern(List<String> labels) {
        List<String> quoted = new ArrayList<>();
        for (String label : labels) {
            quoted.add(Pattern.quote(label));
        }
        return Pattern.compile(
            "(?i)^(?:" + String.join("|", quoted) + ")\\s*[:\u2013-]\\s*(.*)$"
        );
    }

    private String metaContent(Document document, String selector) {
        Element meta = document.selectFirst(selector);
        if (meta == null) {
            return null;
        }
        String content = meta.attr("content").trim();
        return content.isEmpty() ? null : content;
    }

    private static String titleCase(String value) {
        StringBuilder out = new StringBuilder();
        for (String word : value.split(" ")) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return out.toString();
    }

    private List<String> single(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value.trim());
    }
}
