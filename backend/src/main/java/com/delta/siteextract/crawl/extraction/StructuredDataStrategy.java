package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldSchema;
import com.delta.siteextract.crawl.model.FieldSpec;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads JSON-LD blocks. Entity nodes are any object whose {@code @type} is one of the schema's
 * entity types, found anywhere in the block ({@code @graph}, arrays, nesting).
 */
@Component
public class StructuredDataStrategy implements ExtractionStrategy {
    public static final String NAME = "structured_data";

    private final ObjectMapper objectMapper;

    public StructuredDataStrategy(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public double baseConfidence() {
        return 0.9;
    }

    @Override
    public Map<String, List<String>> extract(PageContent page, FieldSchema schema) {
        List<Element> scripts = page.document().select("script[type=application/ld+json]");
        if (scripts.isEmpty()) {
            return Map.of();
        }
        List<JsonNode> entities = new ArrayList<>();
        int parsed = 0;
        JsonProcessingException lastError = null;
        for (Element script : scripts) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload.trim());
                parsed++;
                collectEntities(root, schema, entities);
            } catch (JsonProcessingException e) {
                lastError = e;
            }
        }
        if (parsed == 0 && lastError != null) {
            throw new ExtractionException("no readable JSON-LD on " + page.url(), lastError);
        }

        Map<String, List<String>> out = new LinkedHashMap<>();
        for (FieldSpec field : schema.fields()) {
            for (JsonNode entity : entities) {
                List<String> values = readField(entity, field);
                if (!values.isEmpty()) {
                    out.put(field.name(), values);
                    break;
                }
            }
        }
        return out;
    }

    private void collectEntities(JsonNode node, FieldSchema schema, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (matchesEntityType(node.get("@type"), schema)) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectEntities(value, schema, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectEntities(child, schema, out);
            }
        }
    }

    private boolean matchesEntityType(JsonNode typeNode, FieldSchema schema) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return schema.isEntityType(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && schema.isEntityType(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private List<String> readField(JsonNode entity, FieldSpec field) {
        for (String property : field.propertyNames()) {
            JsonNode value = entity.get(property);
            if (value == null || value.isNull()) {
                continue;
            }
            List<String> values = switch (field.format()) {
                case ADDRESS -> single(address(value));
                case HOURS -> single(hours(value));
                case MENU_ITEMS -> menuItems(value);
                case LINKS -> texts(value);
                case TEXT -> single(joinedText(value));
                default -> single(firstText(value));
            };
            if (!values.isEmpty()) {
                return values;
            }
        }
        return List.of();
    }

    private String address(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            return node.size() == 0 ? null : address(node.get(0));
        }
        if (!node.isObject()) {
            return null;
        }
        String street = text(node, "streetAddress");
        String locality = text(node, "addressLocality");
        String region = text(node, "addressRegion");
        String postal = text(node, "postalCode");
        List<String> parts = new ArrayList<>();
        if (street != null) {
            parts.add(street);
        }
        if (locality != null) {
            parts.add(locality);
        }
        String regionPostal = join(" ", region, postal);
        if (regionPostal != null) {
            parts.add(regionPostal);
        }
        return parts.isEmpty() ? text(node, "name") : String.join(", ", parts);
    }

    private String hours(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        }
        List<String> parts = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode child : node) {
                String part = hours(child);
                if (part != null && !part.isBlank()) {
                    parts.add(part);
                }
            }
        } else if (node.isObject()) {
            String days = dayNames(node.get("dayOfWeek"));
            String opens = text(node, "opens");
            String closes = text(node, "closes");
            String range = opens != null && closes != null ? trimSeconds(opens) + "-" + trimSeconds(closes) : null;
            String part = join(" ", days, range);
            if (part != null) {
                parts.add(part);
            }
        }
        return parts.isEmpty() ? null : String.join("; ", parts);
    }

    private String dayNames(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<String> days = new ArrayList<>();
        for (String raw : texts(node)) {
            int slash = raw.lastIndexOf('/');
            days.add(slash >= 0 ? raw.substring(slash + 1) : raw);
        }
        return days.isEmpty() ? null : String.join(", ", days);
    }

    private List<String> menuItems(JsonNode node) {
        List<String> items = new ArrayList<>();
        collectMenuItems(node, false, items);
        return items;
    }

    private void collectMenuItems(JsonNode node, boolean inItemList, List<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectMenuItems(child, inItemList, out);
            }
            return;
        }
        if (node.isTextual()) {
            // A bare string under hasMenu is usually the menu page URL, not an item.
            if (inItemList) {
                out.add(node.asText());
            }
            return;
        }
        if (!node.isObject()) {
            return;
        }
        if (inItemList || isType(node, "MenuItem")) {
            String name = text(node, "name");
            if (name != null) {
                out.add(name);
            }
            return;
        }
        collectMenuItems(node.get("hasMenuSection"), false, out);
        collectMenuItems(node.get("hasMenuItem"), true, out);
    }

    private boolean isType(JsonNode node, String type) {
        JsonNode typeNode = node.get("@type");
        if (typeNode == null) {
            return false;
        }
        for (String value : texts(typeNode)) {
            if (value.toLowerCase(Locale.ROOT).endsWith(type.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private String joinedText(JsonNode node) {
        if (node.isObject()) {
            return text(node, "name");
        }
        List<String> values = texts(node);
        return values.isEmpty() ? null : String.join(", ", values);
    }

    private String firstText(JsonNode node) {
        List<String> values = texts(node);
        return values.isEmpty() ? null : values.get(0);
    }

    private List<String> texts(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                out.addAll(texts(child));
            }
        } else if (node.isTextual() || node.isNumber()) {
            String value = node.asText().trim();
            if (!value.isEmpty()) {
                out.add(value);
            }
        } else if (node.isObject()) {
            String value = firstNonBlank(text(node, "url"), text(node, "name"), text(node, "@id"));
            if (value != null) {
                out.add(value);
            }
        }
        return out;
    }

    private List<String> single(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value);
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        if (value.isObject()) {
            return text(value, "name");
        }
        return null;
    }

    private static String trimSeconds(String time) {
        return time.matches("^\\d{1,2}:\\d{2}:\\d{2}$") ? time.substring(0, time.length() - 3) : time;
    }

    private static String join(String separator, String... parts) {
        List<String> present = new ArrayList<>();
        for (String part : parts) {
            if (part != null && !part.isBlank()) {
                present.add(part.trim());
            }
        }
        return present.isEmpty() ? null : String.join(separator, present);
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
