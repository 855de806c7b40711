package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.config.ListingSyncProperties;
import com.procrawl.listingsync.ingest.model.PriceHistoryEntry;
import com.procrawl.listingsync.ingest.model.SiteConfig;
import com.procrawl.listingsync.ingest.model.SiteView;
import com.procrawl.listingsync.ingest.model.StatusResponse;
import com.procrawl.listingsync.ingest.model.StoredListing;
import com.procrawl.listingsync.ingest.model.SyncRunView;
import com.procrawl.listingsync.ingest.persistence.ListingJdbcRepository;
import com.procrawl.listingsync.ingest.persistence.SyncRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.NOT_FOUND;

@Service
public class ListingStatusService {
    private static final Logger log = LoggerFactory.getLogger(ListingStatusService.class);
    private static final int MAX_LIMIT = 500;

    private final ListingJdbcRepository listingRepository;
    private final SyncRunRepository syncRunRepository;
    private final SiteConfigRegistry siteConfigRegistry;
    private final ListingSyncProperties properties;

    public ListingStatusService(
        ListingJdbcRepository listingRepository,
        SyncRunRepository syncRunRepository,
        SiteConfigRegistry siteConfigRegistry,
        ListingSyncProperties properties
    ) {
        this.listingRepository = listingRepository;
        this.syncRunRepository = syncRunRepository;
        this.siteConfigRegistry = siteConfigRegistry;
        this.properties = properties;
    }

    public StatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = listingRepository.isDbReachable();
        } catch (DataAccessException e) {
            log.warn("Database not reachable", e);
            dbConnected = false;
        }
        if (!dbConnected) {
            return new StatusResponse(false, new LinkedHashMap<>(), null);
        }
        Map<String, Long> counts = new LinkedHashMap<>(listingRepository.tableCounts());
        listingRepository.countListingsBySite()
            .forEach((site, total) -> counts.put("listings." + site, total));
        return new StatusResponse(true, counts, syncRunRepository.findMostRecentSyncRun());
    }

    public List<SiteView> getSites() {
        return siteConfigRegistry.all().stream()
            .map(this::toSiteView)
            .toList();
    }

    public List<StoredListing> getRecentListings(String site, Integer limit) {
        String siteName = null;
        if (site != null && !site.isBlank()) {
            siteName = siteConfigRegistry.find(site)
                .map(SiteConfig::name)
                .orElseThrow(() -> new UnknownSiteException("Unknown site: " + site));
        }
        return listingRepository.findRecentListings(siteName, clampLimit(limit));
    }

    public StoredListing getListing(String identityKey) {
        requireKey(identityKey);
        return listingRepository.findByIdentityKey(identityKey.trim())
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "Listing not found: " + identityKey));
    }

    public List<PriceHistoryEntry> getPriceHistory(String identityKey) {
        requireKey(identityKey);
        return listingRepository.findPriceHistory(identityKey.trim());
    }

    public List<SyncRunView> getRecentSyncRuns(Integer limit) {
        return syncRunRepository.findRecentSyncRuns(clampLimit(limit));
    }

    private int clampLimit(Integer limit) {
        return limit == null ? properties.getDefaultListLimit() : Math.max(1, Math.min(limit, MAX_LIMIT));
    }

    private void requireKey(String identityKey) {
        if (identityKey == null || identityKey.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "key is required");
        }
    }

    private SiteView toSiteView(SiteConfig config) {
        return new SiteView(
            config.name(),
            config.siteOrigin(),
            config.baseUrl(),
            config.enabled(),
            config.fieldMapping().primaryUrlField(),
            List.copyOf(config.fieldMapping().secondaryUrlFields())
        );
    }
}
