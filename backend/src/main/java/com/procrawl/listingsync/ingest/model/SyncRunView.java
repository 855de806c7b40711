package com.procrawl.listingsync.ingest.model;

import java.time.Instant;

public record SyncRunView(
    long syncRunId,
    String site,
    String status,
    Instant startedAt,
    Instant finishedAt,
    int received,
    int inserted,
    int updated,
    int unchanged,
    int rejected,
    String errorMessage
) {
}
