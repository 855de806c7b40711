package com.procrawl.listingsync.ingest.model;

public enum SyncOutcome {
    INSERTED,
    UPDATED,
    UNCHANGED
}
