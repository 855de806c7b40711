package com.procrawl.listingsync.ingest.model;

import java.util.Map;

public record StatusResponse(
    boolean dbConnectivity,
    Map<String, Long> counts,
    SyncRunView latestRun
) {
}
