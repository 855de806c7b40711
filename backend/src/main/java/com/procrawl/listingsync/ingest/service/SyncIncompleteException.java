package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.ingest.model.ReconciliationReport;

import java.util.List;

/**
 * A batch stopped before every identity key was reconciled. Keys listed in
 * {@link #getPendingKeys()} were not confirmed written; re-running the batch is safe.
 */
public class SyncIncompleteException extends RuntimeException {
    private final List<String> pendingKeys;
    private final transient ReconciliationReport partialReport;

    public SyncIncompleteException(
        String message,
        List<String> pendingKeys,
        ReconciliationReport partialReport,
        Throwable cause
    ) {
        super(message, cause);
        this.pendingKeys = pendingKeys == null ? List.of() : List.copyOf(pendingKeys);
        this.partialReport = partialReport;
    }

    public List<String> getPendingKeys() {
        return pendingKeys;
    }

    public ReconciliationReport getPartialReport() {
        return partialReport;
    }

    public SyncIncompleteException withPartialReport(ReconciliationReport report) {
        return new SyncIncompleteException(getMessage(), pendingKeys, report, getCause());
    }
}
