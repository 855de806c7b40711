package com.procrawl.listingsync.ingest.model;

import java.time.Instant;
import java.util.Map;

public record StoredListing(
    String identityKey,
    String site,
    String canonicalUrl,
    Map<String, Object> fields,
    String contentHash,
    Instant firstSeenAt,
    Instant lastSeenAt,
    Instant updatedAt
) {
}
