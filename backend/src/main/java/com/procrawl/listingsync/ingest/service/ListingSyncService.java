package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.RawListing;
import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.RejectedListing;
import com.procrawl.listingsync.ingest.model.SiteConfig;
import com.procrawl.listingsync.ingest.normalize.NormalizationResult;
import com.procrawl.listingsync.ingest.normalize.RecordNormalizer;
import com.procrawl.listingsync.ingest.persistence.ListingStore;
import com.procrawl.listingsync.ingest.persistence.SyncRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs one extraction batch end to end: resolve the site, normalize every record, reconcile
 * the accepted ones against the store and log the run.
 */
@Service
public class ListingSyncService {
    private static final Logger log = LoggerFactory.getLogger(ListingSyncService.class);

    private final SiteConfigRegistry siteConfigRegistry;
    private final RecordNormalizer normalizer;
    private final ListingSynchronizer synchronizer;
    private final ListingStore store;
    private final SyncRunRepository syncRunRepository;
    private final Executor normalizeExecutor;
    private final Clock clock;

    public ListingSyncService(
        SiteConfigRegistry siteConfigRegistry,
        RecordNormalizer normalizer,
        ListingSynchronizer synchronizer,
        ListingStore store,
        SyncRunRepository syncRunRepository,
        @Qualifier("normalizeExecutor") Executor normalizeExecutor,
        Clock clock
    ) {
        this.siteConfigRegistry = siteConfigRegistry;
        this.normalizer = normalizer;
        this.synchronizer = synchronizer;
        this.store = store;
        this.syncRunRepository = syncRunRepository;
        this.normalizeExecutor = normalizeExecutor;
        this.clock = clock;
    }

    public ReconciliationReport sync(String siteName, List<RawListing> rawListings) {
        SiteConfig site = siteConfigRegistry.require(siteName);
        List<RawListing> raws = rawListings == null ? List.of() : rawListings;
        Long syncRunId = startRun(site.name(), raws.size());

        List<CompletableFuture<NormalizationResult>> futures = new ArrayList<>(raws.size());
        for (RawListing raw : raws) {
            RawListing record = raw == null ? new RawListing(null) : raw;
            futures.add(CompletableFuture.supplyAsync(() -> normalizer.normalize(record, site), normalizeExecutor));
        }

        List<CanonicalListing> accepted = new ArrayList<>();
        List<RejectedListing> rejections = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            NormalizationResult result = futures.get(i).join();
            if (result.isAccepted()) {
                accepted.add(result.listing());
            } else {
                RawListing raw = raws.get(i) == null ? new RawListing(null) : raws.get(i);
                rejections.add(new RejectedListing(i, raw, result.reason(), result.detail()));
                log.debug("Site {}: rejected record {} ({}: {})", site.name(), i, result.reason(), result.detail());
            }
        }

        ReconciliationReport report;
        try {
            report = synchronizer.sync(site.name(), accepted, store).withRejections(raws.size(), rejections);
        } catch (SyncIncompleteException e) {
            ReconciliationReport partial = (e.getPartialReport() == null
                ? ReconciliationReport.empty(site.name())
                : e.getPartialReport()).withRejections(raws.size(), rejections);
            finishRun(syncRunId, "FAILED", partial, e.getMessage());
            throw e.withPartialReport(partial);
        }

        finishRun(syncRunId, "COMPLETED", report, null);
        log.info(
            "Site {} synced: received={}, inserted={}, updated={}, unchanged={}, rejected={}, duplicates={}",
            site.name(),
            report.received(),
            report.inserted(),
            report.updated(),
            report.unchanged(),
            report.rejected(),
            report.duplicatesCollapsed()
        );
        return report;
    }

    private Long startRun(String site, int received) {
        try {
            return syncRunRepository.insertSyncRun(site, clock.instant(), received);
        } catch (DataAccessException | IllegalStateException e) {
            log.warn("Could not record sync run start for site {}", site, e);
            return null;
        }
    }

    private void finishRun(Long syncRunId, String status, ReconciliationReport report, String errorMessage) {
        if (syncRunId == null) {
            return;
        }
        Instant finishedAt = clock.instant();
        try {
            syncRunRepository.completeSyncRun(syncRunId, finishedAt, status, report, errorMessage);
        } catch (DataAccessException e) {
            log.warn("Could not record sync run {} completion", syncRunId, e);
        }
    }
}
