package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.StoredListing;
import com.procrawl.listingsync.ingest.model.SyncOutcome;
import com.procrawl.listingsync.ingest.persistence.ListingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reconciles canonical listings against the store: insert new keys, overwrite changed ones,
 * touch unchanged ones. Keys are independent and run in parallel; each key's read-then-write
 * happens under its lock.
 */
@Service
public class ListingSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(ListingSynchronizer.class);

    private final KeyLocks keyLocks;
    private final Executor syncExecutor;
    private final Clock clock;

    public ListingSynchronizer(
        KeyLocks keyLocks,
        @Qualifier("syncExecutor") Executor syncExecutor,
        Clock clock
    ) {
        this.keyLocks = keyLocks;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    public ReconciliationReport sync(String site, List<CanonicalListing> listings, ListingStore store) {
        List<CanonicalListing> batch = listings == null ? List.of() : listings;
        // Later extraction of the same listing wins, before anything reaches the store.
        Map<String, CanonicalListing> latestByKey = new LinkedHashMap<>();
        int received = 0;
        for (CanonicalListing listing : batch) {
            if (listing == null) {
                continue;
            }
            received++;
            latestByKey.put(listing.identityKey(), listing);
        }
        int duplicatesCollapsed = received - latestByKey.size();
        if (duplicatesCollapsed > 0) {
            log.debug("Site {}: collapsed {} duplicate listings in batch", site, duplicatesCollapsed);
        }

        Instant seenAt = clock.instant();
        Map<String, SyncOutcome> outcomes = new ConcurrentHashMap<>();
        AtomicBoolean aborted = new AtomicBoolean(false);
        List<CompletableFuture<Void>> futures = new ArrayList<>(latestByKey.size());
        for (CanonicalListing listing : latestByKey.values()) {
            futures.add(CompletableFuture.runAsync(
                () -> {
                    if (aborted.get()) {
                        return;
                    }
                    try {
                        outcomes.put(listing.identityKey(), reconcile(listing, store, seenAt));
                    } catch (RuntimeException e) {
                        aborted.set(true);
                        throw e;
                    }
                },
                syncExecutor
            ));
        }

        Throwable failure = null;
        for (CompletableFuture<Void> future : futures) {
            try {
                future.join();
            } catch (CompletionException e) {
                Throwable cause = e.getCause() == null ? e : e.getCause();
                if (failure == null) {
                    failure = cause;
                } else if (failure != cause) {
                    failure.addSuppressed(cause);
                }
            }
        }

        ReconciliationReport report = buildReport(site, received, duplicatesCollapsed, outcomes);
        if (failure != null) {
            List<String> pendingKeys = latestByKey.keySet().stream()
                .filter(key -> !outcomes.containsKey(key))
                .toList();
            log.warn(
                "Site {}: sync aborted after {} of {} keys; {} pending",
                site,
                outcomes.size(),
                latestByKey.size(),
                pendingKeys.size()
            );
            throw new SyncIncompleteException(
                "Store failure while syncing site " + site + ": " + failure.getMessage(),
                pendingKeys,
                report,
                failure
            );
        }
        return report;
    }

    SyncOutcome reconcile(CanonicalListing listing, ListingStore store, Instant seenAt) {
        String key = listing.identityKey();
        return keyLocks.withLock(key, () -> {
            Optional<StoredListing> existing = store.get(key);
            if (existing.isEmpty()) {
                store.put(listing, seenAt);
                return SyncOutcome.INSERTED;
            }
            if (!Objects.equals(existing.get().contentHash(), listing.contentHash())) {
                store.put(listing, seenAt);
                return SyncOutcome.UPDATED;
            }
            store.touch(key, seenAt);
            return SyncOutcome.UNCHANGED;
        });
    }

    private ReconciliationReport buildReport(
        String site,
        int received,
        int duplicatesCollapsed,
        Map<String, SyncOutcome> outcomes
    ) {
        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        for (SyncOutcome outcome : outcomes.values()) {
            switch (outcome) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
        }
        return new ReconciliationReport(site, received, inserted, updated, unchanged, 0, duplicatesCollapsed, List.of());
    }
}
