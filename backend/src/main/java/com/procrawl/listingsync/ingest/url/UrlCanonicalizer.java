package com.procrawl.listingsync.ingest.url;

import com.procrawl.listingsync.ingest.model.RejectionReason;

import java.util.Locale;

/**
 * Turns a URL as scraped from a listing page into an absolute URL. Stateless.
 */
public final class UrlCanonicalizer {
    private static final String HTTP = "http://";
    private static final String HTTPS = "https://";

    private UrlCanonicalizer() {
    }

    /**
     * URLs that already start with {@code http://} or {@code https://} are trusted verbatim apart
     * from lower-casing the scheme; anything else is resolved against {@code base}.
     */
    public static UrlResolution canonicalize(String raw, String base) {
        if (raw == null || raw.isBlank()) {
            return UrlResolution.rejected(RejectionReason.MISSING_URL, "url is empty");
        }
        String candidate = raw.trim();
        if (hasHttpScheme(candidate)) {
            int schemeEnd = candidate.indexOf(':');
            String url = candidate.substring(0, schemeEnd).toLowerCase(Locale.ROOT) + candidate.substring(schemeEnd);
            if (!UriParts.parse(url).hasValidHost()) {
                return UrlResolution.rejected(RejectionReason.UNRESOLVABLE_URL, "no valid host in " + candidate);
            }
            return UrlResolution.resolved(url);
        }

        UriParts reference = UriParts.parse(candidate);
        if (reference.scheme() != null) {
            return UrlResolution.rejected(
                RejectionReason.UNRESOLVABLE_URL,
                "unsupported scheme '" + reference.scheme() + "' in " + candidate
            );
        }
        if (base == null || base.isBlank()) {
            return UrlResolution.rejected(RejectionReason.UNRESOLVABLE_URL, "no base to resolve " + candidate);
        }
        UriParts baseParts = UriParts.parse(base.trim());
        if (baseParts.scheme() == null || !baseParts.hasValidHost()) {
            return UrlResolution.rejected(RejectionReason.UNRESOLVABLE_URL, "base is not absolute: " + base);
        }
        UriParts target = baseParts.resolve(reference);
        if (!target.hasValidHost()) {
            return UrlResolution.rejected(RejectionReason.UNRESOLVABLE_URL, "no valid host after resolving " + candidate);
        }
        return UrlResolution.resolved(
            target.withScheme(target.scheme().toLowerCase(Locale.ROOT)).toString()
        );
    }

    public static boolean hasHttpScheme(String candidate) {
        return candidate.regionMatches(true, 0, HTTP, 0, HTTP.length())
            || candidate.regionMatches(true, 0, HTTPS, 0, HTTPS.length());
    }
}
