package com.procrawl.listingsync.ingest.model;

import java.time.Instant;
import java.util.Map;

public record PriceHistoryEntry(
    long id,
    String identityKey,
    Map<String, Object> previousPrices,
    Instant recordedAt
) {
}
