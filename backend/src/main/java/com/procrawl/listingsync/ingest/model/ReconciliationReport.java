package com.procrawl.listingsync.ingest.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Outcome of one batch: what was written, what was skipped and why.
 */
public record ReconciliationReport(
    String site,
    int received,
    int inserted,
    int updated,
    int unchanged,
    int rejected,
    int duplicatesCollapsed,
    List<RejectedListing> rejections
) {
    public ReconciliationReport {
        rejections = rejections == null ? List.of() : List.copyOf(rejections);
    }

    public static ReconciliationReport empty(String site) {
        return new ReconciliationReport(site, 0, 0, 0, 0, 0, 0, List.of());
    }

    /**
     * Folds normalization rejections into a report produced by the synchronizer.
     */
    public ReconciliationReport withRejections(int receivedCount, List<RejectedListing> moreRejections) {
        List<RejectedListing> merged = new ArrayList<>(rejections);
        if (moreRejections != null) {
            merged.addAll(moreRejections);
        }
        merged.sort(Comparator.comparingInt(RejectedListing::index));
        return new ReconciliationReport(
            site,
            receivedCount,
            inserted,
            updated,
            unchanged,
            merged.size(),
            duplicatesCollapsed,
            merged
        );
    }

    public int written() {
        return inserted + updated;
    }
}
