package com.procrawl.listingsync.ingest.url;

import com.procrawl.listingsync.ingest.model.RejectionReason;

/**
 * Either an absolute URL or the reason one could not be produced.
 */
public record UrlResolution(String url, RejectionReason reason, String detail) {

    public static UrlResolution resolved(String url) {
        return new UrlResolution(url, null, null);
    }

    public static UrlResolution rejected(RejectionReason reason, String detail) {
        return new UrlResolution(null, reason, detail);
    }

    public boolean isResolved() {
        return url != null;
    }
}
