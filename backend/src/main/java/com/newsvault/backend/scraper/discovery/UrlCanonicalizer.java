package com.newsvault.backend.scraper.discovery;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Produces the canonical form of an article URL used as its identity.
 */
public final class UrlCanonicalizer {

    private UrlCanonicalizer() {
    }

    /**
     * Resolves {@code href} against {@code base}, drops the fragment and tracking parameters.
     * Returns null for anything that is not an absolute http(s) URL afterwards.
     */
    public static String canonicalize(String base, String href) {
        if (href == null || href.isBlank()) return null;
        String candidate = href.trim();
        if (candidate.startsWith("//")) {
            candidate = "https:" + candidate; // Convert protocol-relative to HTTPS
        }
        try {
            URI uri = base != null ? new URI(base).resolve(candidate) : new URI(candidate);
            if (uri.getScheme() == null || !uri.getScheme().toLowerCase().startsWith("http") || uri.getHost() == null) {
                return null;
            }
            String query = stripTracking(uri.getRawQuery());
            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            String result = uri.getScheme().toLowerCase() + "://" + uri.getRawAuthority() + path;
            return query == null ? result : result + "?" + query;
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
    }

    public static String canonicalize(String url) {
        return canonicalize(null, url);
    }

    private static String stripTracking(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return null;
        String kept = Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.toLowerCase().startsWith("utm_"))
                .collect(Collectors.joining("&"));
        return kept.isEmpty() ? null : kept;
    }
}
