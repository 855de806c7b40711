package com.procrawl.listingsync.ingest.model;

public record RejectedListing(
    int index,
    RawListing raw,
    RejectionReason reason,
    String detail
) {
}
