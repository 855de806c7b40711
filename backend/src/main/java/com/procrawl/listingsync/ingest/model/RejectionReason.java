package com.procrawl.listingsync.ingest.model;

public enum RejectionReason {
    MISSING_URL,
    UNRESOLVABLE_URL,
    INVALID_PRIMARY_URL,
    MISSING_REQUIRED_FIELD
}
