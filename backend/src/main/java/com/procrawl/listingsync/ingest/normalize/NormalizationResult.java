package com.procrawl.listingsync.ingest.normalize;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.RejectionReason;

public record NormalizationResult(CanonicalListing listing, RejectionReason reason, String detail) {

    public static NormalizationResult accepted(CanonicalListing listing) {
        return new NormalizationResult(listing, null, null);
    }

    public static NormalizationResult rejected(RejectionReason reason, String detail) {
        return new NormalizationResult(null, reason, detail);
    }

    public boolean isAccepted() {
        return listing != null;
    }
}
