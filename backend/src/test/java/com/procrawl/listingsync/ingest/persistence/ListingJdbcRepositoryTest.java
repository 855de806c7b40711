package com.procrawl.listingsync.ingest.persistence;

import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.PriceHistoryEntry;
import com.procrawl.listingsync.ingest.model.StoredListing;
import com.procrawl.listingsync.ingest.normalize.ContentHasher;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ListingJdbcRepositoryTest {
  private static final Instant T1 = Instant.parse("2026-02-01T12:00:00Z");
  private static final Instant T2 = T1.plus(1, ChronoUnit.DAYS);
  private static final Instant T3 = T2.plus(1, ChronoUnit.DAYS);

  @Autowired private ListingJdbcRepository repository;

  @Test
  void storesAndReadsBackListing() {
    String key = uniqueKey();
    CanonicalListing listing = listing(key, "apolar", new BigDecimal("3100"), "Apartamento");

    repository.put(listing, T1);

    StoredListing stored = repository.get(key).orElseThrow();
    assertThat(stored.site()).isEqualTo("apolar");
    assertThat(stored.canonicalUrl()).isEqualTo(key);
    assertThat(stored.contentHash()).isEqualTo(listing.contentHash());
    assertThat(stored.fields()).containsEntry("title", "Apartamento");
    assertThat(stored.fields().get("rent_price_brl").toString()).isEqualTo("3100");
    assertThat(stored.firstSeenAt()).isEqualTo(T1);
    assertThat(stored.lastSeenAt()).isEqualTo(T1);
    assertThat(stored.updatedAt()).isEqualTo(T1);
  }

  @Test
  void missingKeyIsEmpty() {
    assertThat(repository.get(uniqueKey())).isEmpty();
  }

  @Test
  void repeatedPutWithSameContentKeepsUpdatedAt() {
    String key = uniqueKey();
    CanonicalListing listing = listing(key, "apolar", new BigDecimal("3100"), "Apartamento");

    repository.put(listing, T1);
    repository.put(listing, T2);

    StoredListing stored = repository.get(key).orElseThrow();
    assertThat(stored.firstSeenAt()).isEqualTo(T1);
    assertThat(stored.updatedAt()).isEqualTo(T1);
    assertThat(stored.lastSeenAt()).isEqualTo(T2);
  }

  @Test
  void changedContentMovesUpdatedAt() {
    String key = uniqueKey();
    repository.put(listing(key, "apolar", new BigDecimal("3100"), "Apartamento"), T1);
    repository.put(listing(key, "apolar", new BigDecimal("3100"), "Apartamento reformado"), T2);

    StoredListing stored = repository.get(key).orElseThrow();
    assertThat(stored.fields()).containsEntry("title", "Apartamento reformado");
    assertThat(stored.updatedAt()).isEqualTo(T2);
    assertThat(stored.firstSeenAt()).isEqualTo(T1);
  }

  @Test
  void touchOnlyRefreshesLastSeen() {
    String key = uniqueKey();
    CanonicalListing listing = listing(key, "apolar", new BigDecimal("3100"), "Apartamento");
    repository.put(listing, T1);

    repository.touch(key, T2);

    StoredListing stored = repository.get(key).orElseThrow();
    assertThat(stored.lastSeenAt()).isEqualTo(T2);
    assertThat(stored.updatedAt()).isEqualTo(T1);
    assertThat(stored.contentHash()).isEqualTo(listing.contentHash());
  }

  @Test
  void priceChangeIsRecordedInHistory() {
    String key = uniqueKey();
    repository.put(listing(key, "apolar", new BigDecimal("3100"), "Apartamento"), T1);
    repository.put(listing(key, "apolar", new BigDecimal("3300"), "Apartamento"), T2);
    repository.put(listing(key, "apolar", new BigDecimal("3300.00"), "Apartamento mobiliado"), T3);

    List<PriceHistoryEntry> history = repository.findPriceHistory(key);

    assertThat(history).hasSize(1);
    assertThat(history.get(0).identityKey()).isEqualTo(key);
    assertThat(history.get(0).previousPrices().get("rent_price_brl").toString()).isEqualTo("3100");
    assertThat(history.get(0).recordedAt()).isEqualTo(T2);
  }

  @Test
  void firstPriceKeepsExplicitPreviousNulls() {
    String key = uniqueKey();
    repository.put(listing(key, "apolar", null, "Apartamento"), T1);
    repository.put(listing(key, "apolar", new BigDecimal("2500"), "Apartamento"), T2);

    List<PriceHistoryEntry> history = repository.findPriceHistory(key);

    assertThat(history).hasSize(1);
    assertThat(history.get(0).previousPrices())
        .containsOnlyKeys("rent_price_brl", "condo_fee_brl")
        .containsEntry("rent_price_brl", null)
        .containsEntry("condo_fee_brl", null);
  }

  @Test
  void recentListingsCanBeFilteredBySite() {
    String apolarKey = uniqueKey();
    String otherKey = uniqueKey();
    repository.put(listing(apolarKey, "apolar", new BigDecimal("1000"), "A"), T1);
    repository.put(listing(otherKey, "galvao", new BigDecimal("2000"), "B"), T2);

    List<StoredListing> apolar = repository.findRecentListings("apolar", 500);
    List<StoredListing> all = repository.findRecentListings(null, 500);

    assertThat(apolar).extracting(StoredListing::identityKey).contains(apolarKey).doesNotContain(otherKey);
    assertThat(all).extracting(StoredListing::identityKey).contains(apolarKey, otherKey);
    assertThat(repository.countListingsBySite()).containsKeys("apolar", "galvao");
  }

  private static String uniqueKey() {
    return "https://www.apolar.com.br/imovel/" + UUID.randomUUID();
  }

  private static CanonicalListing listing(String key, String site, BigDecimal price, String title) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("property_url", key);
    if (price != null) {
      fields.put("rent_price_brl", price);
    }
    fields.put("title", title);
    return new CanonicalListing(site, key, key, fields, ContentHasher.hash(fields));
  }
}
