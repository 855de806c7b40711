package com.procrawl.listingsync.ingest.url;

import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Derives the deduplication key of a listing from its canonical URL.
 */
public final class IdentityKeys {
    private IdentityKeys() {
    }

    /**
     * Drops tracking query parameters and an empty trailing {@code ?} or {@code #}, and lower-cases
     * the host. Path, parameter order and the remaining query keep their casing.
     */
    public static String derive(String canonicalUrl, Set<String> trackingParameters) {
        UriParts parts = UriParts.parse(canonicalUrl).withLowerCaseHost();
        if (parts.scheme() != null) {
            parts = parts.withScheme(parts.scheme().toLowerCase(Locale.ROOT));
        }
        parts = parts.withQuery(stripTracking(parts.query(), trackingParameters));
        if (parts.fragment() != null && parts.fragment().isEmpty()) {
            parts = parts.withFragment(null);
        }
        return parts.toString();
    }

    private static String stripTracking(String query, Set<String> trackingParameters) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        StringJoiner kept = new StringJoiner("&");
        for (String parameter : query.split("&")) {
            if (parameter.isEmpty()) {
                continue;
            }
            int eq = parameter.indexOf('=');
            String name = (eq == -1 ? parameter : parameter.substring(0, eq)).toLowerCase(Locale.ROOT);
            if (trackingParameters != null && trackingParameters.contains(name)) {
                continue;
            }
            kept.add(parameter);
        }
        String joined = kept.toString();
        return joined.isEmpty() ? null : joined;
    }
}
