package com.delta.siteextract.crawl.extraction;

import com.delta.siteextract.crawl.model.FieldFormat;
import com.delta.siteextract.crawl.util.UrlNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical forms for extracted values, plus the small confidence bonus given to values that
 * look fully formed.
 */
public final class FieldNormalizer {
    public static final double COMPLETENESS_BONUS = 0.05;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_DIGIT = Pattern.compile("\\D");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("([a-z])([A-Z])");
    private static final Pattern COMMA_SPACING = Pattern.compile("\\s*,\\s*");
    private static final Pattern STATE_ZIP_JOINED = Pattern.compile(",\\s*([A-Z]{2})(\\d{5})");
    private static final Pattern DOLLAR_TIER = Pattern.compile("^\\${1,4}$");
    private static final Pattern NUMERIC_RANGE = Pattern.compile("\\$?\\s*(\\d{1,4})\\s*(?:-|\u2013|\u2014|to)\\s*\\$?\\s*(\\d{1,4})");
    private static final Pattern HOURS_DASH = Pattern.compile("\\s*[\u2013\u2014-]\\s*");
    private static final Pattern FULL_ADDRESS = Pattern.compile("^\\d+\\s+.+,.+\\b[A-Z]{2}\\s*\\d{5}(-\\d{4})?$");
    private static final Pattern HOURS_COMPLETE = Pattern.compile(
        "(?i)(mon|tue|wed|thu|fri|sat|sun|daily|every day).*\\d{1,2}(:\\d{2})?\\s*(am|pm)?\\s*-\\s*\\d{1,2}(:\\d{2})?"
    );
    private static final Pattern EMAIL = Pattern.compile("^[\\w.+-]+@[\\w-]+(\\.[\\w-]+)+$");
    private static final int MAX_TEXT_LENGTH = 1000;

    private FieldNormalizer() {
    }

    /**
     * Returns the canonical form of {@code raw}, or {@code null} when nothing usable remains.
     */
    public static String normalize(FieldFormat format, String raw) {
        if (raw == null) {
            return null;
        }
        String value = collapse(raw);
        if (value.isEmpty()) {
            return null;
        }
        String normalized = switch (format) {
            case PHONE -> normalizePhone(value);
            case ADDRESS -> normalizeAddress(value);
            case PRICE_RANGE -> normalizePriceRange(value);
            case HOURS -> normalizeHours(value);
            case EMAIL -> normalizeEmail(value);
            case LINKS -> UrlNormalizer.normalize(value);
            case NAME, MENU_ITEMS -> stripTrailingPunctuation(value);
            case TEXT -> truncate(value);
        };
        return normalized == null || normalized.isBlank() ? null : normalized;
    }

    /**
     * Normalizes each item and drops blanks and case/whitespace-insensitive duplicates, keeping
     * first appearance order.
     */
    public static List<String> normalizeList(FieldFormat format, List<String> raw) {
        List<String> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String item : raw) {
            String normalized = normalize(format, item);
            if (normalized != null && seen.add(dedupKey(normalized))) {
                out.add(normalized);
            }
        }
        return out;
    }

    public static String dedupKey(String value) {
        return value == null ? "" : collapse(value).toLowerCase(Locale.ROOT);
    }

    public static double completenessBonus(FieldFormat format, List<String> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        String first = values.get(0);
        boolean complete = switch (format) {
            case PHONE -> first.matches("^\\(\\d{3}\\) \\d{3}-\\d{4}$");
            case ADDRESS -> FULL_ADDRESS.matcher(first).find();
            case HOURS -> HOURS_COMPLETE.matcher(first).find();
            case PRICE_RANGE -> DOLLAR_TIER.matcher(first).matches() || first.matches("^\\$\\d+-\\$\\d+$");
            case EMAIL -> EMAIL.matcher(first).matches();
            case MENU_ITEMS -> values.size() >= 3;
            default -> false;
        };
        return complete ? COMPLETENESS_BONUS : 0.0;
    }

    static String normalizePhone(String value) {
        String digits = NON_DIGIT.matcher(value).replaceAll("");
        if (digits.length() == 11 && digits.charAt(0) == '1') {
            digits = digits.substring(1);
        }
        if (digits.length() == 10) {
            return "(" + digits.substring(0, 3) + ") " + digits.substring(3, 6) + "-" + digits.substring(6);
        }
        if (digits.length() == 7) {
            return digits.substring(0, 3) + "-" + digits.substring(3);
        }
        if (digits.length() < 7) {
            return null;
        }
        return value;
    }

    static String normalizeAddress(String value) {
        String address = CAMEL_BOUNDARY.matcher(value).replaceAll("$1 $2");
        address = STATE_ZIP_JOINED.matcher(address).replaceAll(", $1 $2");
        address = COMMA_SPACING.matcher(address).replaceAll(", ");
        address = collapse(address);
        while (address.endsWith(",")) {
            address = address.substring(0, address.length() - 1).trim();
        }
        return address;
    }

    static String normalizePriceRange(String value) {
        String compact = value.replace(" ", "");
        if (DOLLAR_TIER.matcher(compact).matches()) {
            return compact;
        }
        Matcher range = NUMERIC_RANGE.matcher(value);
        if (range.find()) {
            return "$" + range.group(1) + "-$" + range.group(2);
        }
        return value;
    }

    static String normalizeHours(String value) {
        String hours = value.replaceFirst("(?i)^(business\\s+|opening\\s+)?hours?\\s*:?\\s*", "");
        hours = HOURS_DASH.matcher(hours).replaceAll("-");
        return collapse(hours);
    }

    static String normalizeEmail(String value) {
        String email = value.toLowerCase(Locale.ROOT);
        if (email.startsWith("mailto:")) {
            email = email.substring("mailto:".length());
        }
        int query = email.indexOf('?');
        if (query >= 0) {
            email = email.substring(0, query);
        }
        return EMAIL.matcher(email).matches() ? email : null;
    }

    private static String stripTrailingPunctuation(String value) {
        String out = value;
        while (!out.isEmpty() && ":;,|-\u2013".indexOf(out.charAt(out.length() - 1)) >= 0) {
            out = out.substring(0, out.length() - 1).trim();
        }
        return truncate(out);
    }

    private static String truncate(String value) {
        return value.length() > MAX_TEXT_LENGTH ? value.substring(0, MAX_TEXT_LENGTH).trim() : value;
    }

    private static String collapse(String value) {
        return WHITESPACE.matcher(value.replace('\u00a0', ' ')).replaceAll(" ").trim();
    }
}
