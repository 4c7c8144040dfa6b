package com.marketwatch.tracker.scrape.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class ListingUrlUtils {
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/(\\d{5,})(?:/|$)");

    private ListingUrlUtils() {
    }

    public static String absolutize(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("//")) {
            return "https:" + trimmed;
        }
        URI base = safeUri(baseUrl);
        if (base == null) {
            return trimmed;
        }
        try {
            return base.resolve(trimmed).toString();
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Lower-cased scheme and host, no query, fragment or trailing slash.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        URI uri = safeUri(url.trim());
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return scheme + "://" + uri.getHost().toLowerCase(Locale.ROOT) + path;
    }

    public static String lastPathSegment(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        String path = uri.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        int idx = path.lastIndexOf('/');
        String segment = idx >= 0 ? path.substring(idx + 1) : path;
        return segment.isBlank() ? null : segment;
    }

    public static String numericId(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getPath() == null) {
            return null;
        }
        Matcher matcher = NUMERIC_SEGMENT.matcher(uri.getPath());
        String found = null;
        while (matcher.find()) {
            found = matcher.group(1);
        }
        return found;
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
