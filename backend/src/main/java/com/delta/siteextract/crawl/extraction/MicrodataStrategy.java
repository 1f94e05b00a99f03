package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldFormat;
import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldSpec;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads microdata ({@code itemscope}/{@code itemtype}/{@code itemprop}) and RDFa Lite
 * ({@code typeof}/{@code property}) markup.
 */
@Component
public class MicrodataStrategy implements ExtractionStrategy {
    public static final String NAME = "microdata";

    private static final List<String> ADDRESS_PARTS = List.of("streetAddress", "addressLocality", "addressRegion", "postalCode");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double baseConfidence() {
        return 0.7;
    }

    @Override
    public Map<String, List<String>> extract(PageContent page, FieldSchema schema) {
        List<Element> entities = new ArrayList<>();
        for (Element scope : page.document().select("[itemscope][itemtype], [typeof]")) {
            if (matchesEntityType(scope, schema)) {
                entities.add(scope);
            }
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            List<String> values = List.of();
            for (Element entity : entities) {
                values = readField(entity, field);
                if (!values.isEmpty()) {
                    break;
                }
            }
            if (values.isEmpty() && field.format() == FieldFormat.MENU_ITEMS) {
                values = standaloneMenuItems(page);
            }
            if (!values.isEmpty()) {
                out.put(field.name(), values);
            }
        }
        return out;
    }

    private boolean matchesEntityType(Element scope, FieldSchema schema) {
        String types = scope.hasAttr("itemtype") ? scope.attr("itemtype") : scope.attr("typeof");
        for (String type : types.trim().split("\\s+")) {
            if (!type.isBlank() && schema.isEntityType(type)) {
                return true;
            }
        }
        return false;
    }

    private List<String> readField(Element entity, FieldSpec field) {
        for (String property : field.propertyNames()) {
            List<Element> props = ownProperties(entity, property);
            if (props.isEmpty()) {
                continue;
            }
            List<String> values = switch (field.format()) {
                case ADDRESS -> single(address(props.get(0)));
                case HOURS -> single(joinValues(props, "; "));
                case MENU_ITEMS -> menuItems(props);
                case LINKS -> allValues(props);
                case TEXT -> single(joinValues(props, ", "));
                default -> single(propertyValue(props.get(0)));
            };
            if (!values.isEmpty()) {
                return values;
            }
        }
        return List.of();
    }

    /**
     * Properties owned directly by {@code scope}: nested scopes keep their own properties.
     */
    private List<Element> ownProperties(Element scope, String property) {
        List<Element> out = new ArrayList<>();
        for (Element candidate : scope.select("[itemprop], [property]")) {
            if (candidate == scope || !hasProperty(candidate, property)) {
                continue;
            }
            if (owningScope(candidate) == scope) {
                out.add(candidate);
            }
        }
        return out;
    }

    private boolean hasProperty(Element element, String property) {
        String names = element.hasAttr("itemprop") ? element.attr("itemprop") : element.attr("property");
        for (String name : names.trim().split("\\s+")) {
            String local = name.contains(":") ? name.substring(name.lastIndexOf(':') + 1) : name;
            if (local.equalsIgnoreCase(property)) {
                return true;
            }
        }
        return false;
    }

    private Element owningScope(Element element) {
        Element parent = element.parent();
        while (parent != null) {
            if (isScope(parent)) {
                return parent;
            }
            parent = parent.parent();
        }
        return null;
    }

    private boolean isScope(Element element) {
        return element.hasAttr("itemscope") || element.hasAttr("typeof");
    }

    private String address(Element element) {
        if (!isScope(element)) {
            return propertyValue(element);
        }
        List<String> parts = new ArrayList<>();
        String regionPostal = null;
        for (String part : ADDRESS_PARTS) {
            List<Element> props = ownProperties(element, part);
            if (props.isEmpty()) {
                continue;
            }
            String value = propertyValue(props.get(0));
            if (value == null) {
                continue;
            }
            if ("addressRegion".equals(part)) {
                regionPostal = value;
            } else if ("postalCode".equals(part)) {
                regionPostal = regionPostal == null ? value : regionPostal + " " + value;
            } else {
                parts.add(value);
            }
        }
        if (regionPostal != null) {
            parts.add(regionPostal);
        }
        return parts.isEmpty() ? element.text() : String.join(", ", parts);
    }

    private List<String> menuItems(List<Element> props) {
        List<String> items = new ArrayList<>();
        for (Element prop : props) {
            List<String> names = menuItemNames(prop);
            if (names.isEmpty() && !isScope(prop)) {
                String text = propertyValue(prop);
                // A plain hasMenu/menu property holds a URL to the menu, not items.
                if (text != null && !prop.hasAttr("href")) {
                    names = List.of(text);
                }
            }
            items.addAll(names);
        }
        return items;
    }

    private List<String> menuItemNames(Element container) {
        List<String> items = new ArrayList<>();
        for (Element item : container.select("[itemtype], [typeof]")) {
            String type = (item.attr("itemtype") + " " + item.attr("typeof")).toLowerCase(Locale.ROOT);
            if (!type.contains("menuitem")) {
                continue;
            }
            List<Element> names = ownProperties(item, "name");
            String name = names.isEmpty() ? null : propertyValue(names.get(0));
            if (name != null) {
                items.add(name);
            }
        }
        return items;
    }

    /** MenuItem scopes outside any entity, e.g. a menu page with no Restaurant wrapper. */
    private List<String> standaloneMenuItems(PageContent page) {
        if (page.document().body() == null) {
            return List.of();
        }
        return menuItemNames(page.document().body());
    }

    private String propertyValue(Element element) {
        String value;
        if (element.hasAttr("content")) {
            value = element.attr("content");
        } else if (element.hasAttr("datetime")) {
            value = element.attr("datetime");
        } else if (element.is("a[href], link[href], area[href]")) {
            value = element.attr("abs:href");
            if (value.isBlank()) {
                value = element.attr("href");
            }
        } else if (element.is("img[src], audio[src], video[src]")) {
            value = element.attr("abs:src");
        } else if (element.is("meta")) {
            value = element.attr("content");
        } else {
            value = element.text();
        }
        value = value == null ? null : value.trim();
        return value == null || value.isEmpty() ? null : value;
    }

    private String joinValues(List<Element> props, String separator) {
        List<String> values = allValues(props);
        return values.isEmpty() ? null : String.join(separator, values);
    }

    private List<String> allValues(List<Element> props) {
        List<String> values = new ArrayList<>();
        for (Element prop : props) {
            String value = propertyValue(prop);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private List<String> single(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value);
    }
}
