package com.procrawl.listingsync.ingest.api;

import com.procrawl.listingsync.ingest.model.PriceHistoryEntry;
import com.procrawl.listingsync.ingest.model.RawListing;
import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.SiteView;
import com.procrawl.listingsync.ingest.model.StatusResponse;
import com.procrawl.listingsync.ingest.model.StoredListing;
import com.procrawl.listingsync.ingest.model.SyncRunView;
import com.procrawl.listingsync.ingest.service.ListingStatusService;
import com.procrawl.listingsync.ingest.service.ListingSyncService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class SyncController {
    private final ListingSyncService listingSyncService;
    private final ListingStatusService listingStatusService;

    public SyncController(ListingSyncService listingSyncService, ListingStatusService listingStatusService) {
        this.listingSyncService = listingSyncService;
        this.listingStatusService = listingStatusService;
    }

    @PostMapping("/sites/{site}/sync")
    public ReconciliationReport sync(
        @PathVariable("site") String site,
        @RequestBody(required = false) List<RawListing> listings
    ) {
        return listingSyncService.sync(site, listings == null ? List.of() : listings);
    }

    @GetMapping("/sites")
    public List<SiteView> sites() {
        return listingStatusService.getSites();
    }

    @GetMapping("/listings")
    public List<StoredListing> listings(
        @RequestParam(name = "site", required = false) String site,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        return listingStatusService.getRecentListings(site, limit);
    }

    @GetMapping("/listings/by-key")
    public StoredListing listing(@RequestParam(name = "key", required = false) String key) {
        return listingStatusService.getListing(key);
    }

    @GetMapping("/listings/price-history")
    public List<PriceHistoryEntry> priceHistory(@RequestParam(name = "key", required = false) String key) {
        return listingStatusService.getPriceHistory(key);
    }

    @GetMapping("/sync-runs")
    public List<SyncRunView> syncRuns(@RequestParam(name = "limit", required = false) Integer limit) {
        return listingStatusService.getRecentSyncRuns(limit);
    }

    @GetMapping("/status")
    public StatusResponse status() {
        return listingStatusService.getStatus();
    }
}
