package com.delta.siteextract.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Canonical URL forms used for crawl dedup and same-origin checks.
 *
 * <p>{@link #normalize(String)} lowercases scheme and host, drops default ports, fragments and
 * tracking parameters, sorts the remaining query parameters and strips a trailing slash from any
 * path except the root. Anything that is not an absolute http(s) URL normalizes to {@code null}.
 */
public final class UrlNormalizer {
    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "msclkid", "mc_cid", "mc_eid");
    private static final List<String> ASSET_EXTENSIONS = List.of(
        ".jpg", ".jpeg", ".png", ".gif", ".svg", ".webp", ".ico", ".bmp",
        ".css", ".js", ".json", ".xml",
        ".pdf", ".zip", ".gz", ".rar", ".mp3", ".mp4", ".mov", ".avi", ".woff", ".woff2", ".ttf"
    );

    private UrlNormalizer() {
    }

    public static String normalize(String url) {
        URI uri = safeUri(url == null ? null : url.trim());
        if (uri == null || !isHttp(uri) || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        String query = filterQuery(uri.getRawQuery());

        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            out.append(':').append(port);
        }
        out.append(path);
        if (query != null) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    /**
     * Resolves an href found on {@code baseUrl} and normalizes the result. Returns {@code null}
     * for fragment-only, {@code mailto:}, {@code tel:}, {@code javascript:} and other non-http
     * targets.
     */
    public static String resolve(String baseUrl, String href) {
        if (href == null) {
            return null;
        }
        String candidate = href.trim();
        if (candidate.isEmpty() || candidate.startsWith("#")) {
            return null;
        }
        String lower = candidate.toLowerCase(Locale.ROOT);
        if (lower.startsWith("mailto:") || lower.startsWith("tel:") || lower.startsWith("javascript:")
            || lower.startsWith("data:") || lower.startsWith("sms:")) {
            return null;
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return normalize(candidate);
        }
        try {
            return normalize(base.resolve(candidate.replace(" ", "%20")).toString());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * {@code host[:port]} key used for per-domain rate limiting and robots caching.
     */
    public static String hostKey(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1 || isDefaultPort(scheme, port)) {
            return host;
        }
        return host + ":" + port;
    }

    public static String origin(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        return scheme + "://" + hostKey(url);
    }

    public static boolean isSameOrigin(String rootUrl, String candidateUrl) {
        String rootOrigin = origin(rootUrl);
        return rootOrigin != null && rootOrigin.equals(origin(candidateUrl));
    }

    public static boolean isAsset(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return false;
        }
        String path = uri.getPath().toLowerCase(Locale.ROOT);
        for (String extension : ASSET_EXTENSIONS) {
            if (path.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public static String pathAndQuery(String url) {
        URI uri = safeUri(url);
        if (uri == null) {
            return "/";
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isHttp(URI uri) {
        String scheme = uri.getScheme();
        return scheme != null && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    }

    private static String filterQuery(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
            .filter(param -> !param.isEmpty())
            .filter(param -> {
                String key = (param.contains("=") ? param.substring(0, param.indexOf('=')) : param).toLowerCase(Locale.ROOT);
                return !key.startsWith("utm_") && !TRACKING_PARAMS.contains(key);
            })
            .sorted()
            .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
    }
}
