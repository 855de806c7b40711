package com.procrawl.listingsync.ingest.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record CanonicalListing(
    String site,
    String identityKey,
    String canonicalUrl,
    Map<String, Object> fields,
    String contentHash
) {
    public CanonicalListing {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(fields));
    }
}
