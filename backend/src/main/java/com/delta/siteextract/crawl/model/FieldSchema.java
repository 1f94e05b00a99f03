package com.delta.siteextract.crawl.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered set of fields extracted for one target domain, plus the structured-data entity types
 * that describe that domain.
 */
public record FieldSchema(String domain, List<String> entityTypes, List<FieldSpec> fields) {

    public FieldSchema {
        entityTypes = entityTypes == null ? List.of() : List.copyOf(entityTypes);
        fields = fields == null ? List.of() : List.copyOf(fields);
        Map<String, FieldSpec> seen = new LinkedHashMap<>();
        for (FieldSpec field : fields) {
            if (seen.putIfAbsent(field.name(), field) != null) {
                throw new IllegalArgumentException("duplicate field in schema: " + field.name());
            }
        }
    }

    public Optional<FieldSpec> field(String name) {
        for (FieldSpec field : fields) {
            if (field.name().equals(name)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }

    public List<String> fieldNames() {
        return fields.stream().map(FieldSpec::name).toList();
    }

    public boolean isEntityType(String type) {
        if (type == null) {
            return false;
        }
        String candidate = stripVocabulary(type).toLowerCase(Locale.ROOT);
        for (String entityType : entityTypes) {
            if (entityType.toLowerCase(Locale.ROOT).equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String stripVocabulary(String type) {
        String trimmed = type.trim();
        int slash = trimmed.lastIndexOf('/');
        if (slash >= 0 && slash < trimmed.length() - 1) {
            trimmed = trimmed.substring(slash + 1);
        }
        int colon = trimmed.lastIndexOf(':');
        if (colon >= 0 && colon < trimmed.length() - 1) {
            trimmed = trimmed.substring(colon + 1);
        }
        return trimmed;
    }

    public static FieldSchema restaurant() {
        return new FieldSchema(
            "restaurant",
            List.of("Restaurant", "FoodEstablishment", "LocalBusiness", "CafeOrCoffeeShop", "BarOrPub", "Bakery", "FastFoodRestaurant"),
            List.of(
                FieldSpec.required("name", 1.0, FieldFormat.NAME, List.of("name"), List.of()),
                FieldSpec.required("address", 1.0, FieldFormat.ADDRESS, List.of("address"), List.of("Address", "Location", "Find us", "Visit us")),
                FieldSpec.required("phone", 1.0, FieldFormat.PHONE, List.of("telephone", "phone"), List.of("Phone", "Tel", "Telephone", "Call us", "Call")),
                FieldSpec.optional("hours", 0.6, FieldFormat.HOURS, List.of("openingHours", "openingHoursSpecification"), List.of("Hours", "Opening hours", "Open", "Business hours")),
                FieldSpec.optional("cuisine", 0.5, FieldFormat.TEXT, List.of("servesCuisine"), List.of("Cuisine")),
                FieldSpec.optional("price_range", 0.4, FieldFormat.PRICE_RANGE, List.of("priceRange"), List.of("Price range", "Prices")),
                FieldSpec.list("menu_items", 0.6, FieldFormat.MENU_ITEMS, List.of("hasMenu", "menu"), List.of()),
                FieldSpec.optional("email", 0.3, FieldFormat.EMAIL, List.of("email"), List.of("Email", "E-mail")),
                FieldSpec.list("social_media", 0.3, FieldFormat.LINKS, List.of("sameAs"), List.of()),
                FieldSpec.optional("description", 0.2, FieldFormat.TEXT, List.of("description"), List.of())
            )
        );
    }
}
