package com.procrawl.listingsync.ingest.persistence;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.StoredListing;

import java.time.Instant;
import java.util.Optional;

/**
 * Narrow per-key contract the synchronizer writes through. Each call is atomic for its key;
 * failures are reported as {@link StoreUnavailableException}.
 */
public interface ListingStore {

    Optional<StoredListing> get(String identityKey);

    /**
     * Inserts or overwrites the row for {@code listing.identityKey()}. Repeating a call with the
     * same arguments leaves the store unchanged.
     */
    void put(CanonicalListing listing, Instant seenAt);

    /**
     * Refreshes last-seen only; field data is not written.
     */
    void touch(String identityKey, Instant seenAt);
}
