package com.delta.siteextract.crawl.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.regex.Pattern;

public final class HashUtils {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private HashUtils() {
    }

    public static String sha256Hex(String value) {
        return sha256Hex(value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    public static String sha256Hex(byte[] value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value);
            StringBuilder out = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                out.append(String.format("%02x", b));
            }
            return out.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }

    /**
     * Hash of a page body with whitespace runs collapsed, so re-served copies of the same page
     * compare equal regardless of formatting.
     */
    public static String contentFingerprint(String body) {
        if (body == null) {
            return sha256Hex("");
        }
        return sha256Hex(WHITESPACE.matcher(body.trim()).replaceAll(" "));
    }
}
