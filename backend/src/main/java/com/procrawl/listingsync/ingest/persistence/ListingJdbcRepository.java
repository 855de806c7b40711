package com.procrawl.listingsync.ingest.persistence;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.procrawl.listingsync.config.ListingSyncProperties;
import com.procrawl.listingsync.ingest.model.CanonicalListing;
import com.procrawl.listingsync.ingest.model.PriceHistoryEntry;
import com.procrawl.listingsync.ingest.model.StoredListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Repository
public class ListingJdbcRepository implements ListingStore {
    private static final Logger log = LoggerFactory.getLogger(ListingJdbcRepository.class);
    private static final TypeReference<Map<String, Object>> FIELD_MAP = new TypeReference<>() {};

    private final ObjectMapper objectMapper = new ObjectMapper()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final NamedParameterJdbcTemplate jdbc;
    private final boolean postgres;
    private final ListingSyncProperties properties;

    public ListingJdbcRepository(NamedParameterJdbcTemplate jdbc, ListingSyncProperties properties) {
        this.jdbc = jdbc;
        this.postgres = detectPostgres(jdbc);
        this.properties = properties;
    }

    @Override
    public Optional<StoredListing> get(String identityKey) {
        try {
            return findByIdentityKey(identityKey);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read listing " + identityKey, identityKey, e);
        }
    }

    @Override
    @Transactional
    public void put(CanonicalListing listing, Instant seenAt) {
        String identityKey = listing.identityKey();
        try {
            String previousJson = findFieldsJson(identityKey);
            if (previousJson != null) {
                recordPriceChange(identityKey, readFields(previousJson), listing.fields(), seenAt);
            }
            MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("identityKey", identityKey)
                .addValue("site", listing.site())
                .addValue("canonicalUrl", listing.canonicalUrl())
                .addValue("fieldsJson", writeJson(listing.fields()))
                .addValue("contentHash", listing.contentHash())
                .addValue("seenAt", toTimestamp(seenAt));
            if (postgres) {
                upsertListingPostgres(params);
            } else {
                upsertListingLegacy(params);
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to write listing " + identityKey, identityKey, e);
        }
    }

    @Override
    public void touch(String identityKey, Instant seenAt) {
        try {
            int updated = jdbc.update(
                """
                    UPDATE listings
                    SET last_seen_at = :seenAt
                    WHERE identity_key = :identityKey
                    """,
                new MapSqlParameterSource()
                    .addValue("identityKey", identityKey)
                    .addValue("seenAt", toTimestamp(seenAt))
            );
            if (updated == 0) {
                log.debug("Touch found no listing for {}", identityKey);
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to refresh listing " + identityKey, identityKey, e);
        }
    }

    public Optional<StoredListing> findByIdentityKey(String identityKey) {
        List<StoredListing> rows = jdbc.query(
            """
                SELECT identity_key, site, canonical_url, fields_json, content_hash,
                       first_seen_at, last_seen_at, updated_at
                FROM listings
                WHERE identity_key = :identityKey
                """,
            new MapSqlParameterSource().addValue("identityKey", identityKey),
            storedListingRowMapper()
        );
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    public List<StoredListing> findRecentListings(String site, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("site", site == null || site.isBlank() ? null : site.trim())
            .addValue("limit", Math.max(1, limit));
        return jdbc.query(
            """
                SELECT identity_key, site, canonical_url, fields_json, content_hash,
                       first_seen_at, last_seen_at, updated_at
                FROM listings
                WHERE (CAST(:site AS VARCHAR) IS NULL OR site = :site)
                ORDER BY last_seen_at DESC, identity_key
                LIMIT :limit
                """,
            params,
            storedListingRowMapper()
        );
    }

    public List<PriceHistoryEntry> findPriceHistory(String identityKey) {
        return jdbc.query(
            """
                SELECT id, identity_key, previous_prices_json, recorded_at
                FROM listing_price_history
                WHERE identity_key = :identityKey
                ORDER BY recorded_at DESC, id DESC
                """,
            new MapSqlParameterSource().addValue("identityKey", identityKey),
            (rs, rowNum) -> new PriceHistoryEntry(
                rs.getLong("id"),
                rs.getString("identity_key"),
                readFields(rs.getString("previous_prices_json")),
                toInstant(rs.getTimestamp("recorded_at"))
            )
        );
    }

    public Map<String, Long> countListingsBySite() {
        Map<String, Long> counts = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT site, COUNT(*) AS total
                FROM listings
                GROUP BY site
                ORDER BY total DESC, site
                """,
            new MapSqlParameterSource(),
            rs -> {
                counts.put(rs.getString("site"), rs.getLong("total"));
            }
        );
        return counts;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public Map<String, Long> tableCounts() {
        Map<String, Long> counts = new LinkedHashMap<>();
        counts.put("listings", countTable("listings"));
        counts.put("listing_price_history", countTable("listing_price_history"));
        counts.put("sync_runs", countTable("sync_runs"));
        return counts;
    }

    private long countTable(String tableName) {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + tableName, Long.class);
        return count == null ? 0L : count;
    }

    private String findFieldsJson(String identityKey) {
        List<String> rows = jdbc.query(
            """
                SELECT fields_json
                FROM listings
                WHERE identity_key = :identityKey
                """,
            new MapSqlParameterSource().addValue("identityKey", identityKey),
            (rs, rowNum) -> rs.getString("fields_json")
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    private void upsertListingPostgres(MapSqlParameterSource params) {
        jdbc.update(
            """
                INSERT INTO listings (
                    identity_key, site, canonical_url, fields_json, content_hash,
                    first_seen_at, last_seen_at, updated_at
                )
                VALUES (
                    :identityKey, :site, :canonicalUrl, :fieldsJson, :contentHash,
                    :seenAt, :seenAt, :seenAt
                )
                ON CONFLICT (identity_key)
                DO UPDATE SET
                    site = EXCLUDED.site,
                    canonical_url = EXCLUDED.canonical_url,
                    fields_json = EXCLUDED.fields_json,
                    updated_at = CASE
                        WHEN listings.content_hash = EXCLUDED.content_hash THEN listings.updated_at
                        ELSE EXCLUDED.updated_at
                    END,
                    content_hash = EXCLUDED.content_hash,
                    last_seen_at = EXCLUDED.last_seen_at
                """,
            params
        );
    }

    private void upsertListingLegacy(MapSqlParameterSource params) {
        int updated = updateListing(params);
        if (updated > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO listings (
                        identity_key, site, canonical_url, fields_json, content_hash,
                        first_seen_at, last_seen_at, updated_at
                    )
                    VALUES (
                        :identityKey, :site, :canonicalUrl, :fieldsJson, :contentHash,
                        :seenAt, :seenAt, :seenAt
                    )
                    """,
                params
            );
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent insert for {}, retrying as update", params.getValue("identityKey"));
            updateListing(params);
        }
    }

    private int updateListing(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE listings
                SET site = :site,
                    canonical_url = :canonicalUrl,
                    fields_json = :fieldsJson,
                    updated_at = CASE WHEN content_hash = :contentHash THEN updated_at ELSE :seenAt END,
                    content_hash = :contentHash,
                    last_seen_at = :seenAt
                WHERE identity_key = :identityKey
                """,
            params
        );
    }

    private void recordPriceChange(
        String identityKey,
        Map<String, Object> previous,
        Map<String, Object> next,
        Instant recordedAt
    ) {
        Map<String, Object> previousPrices = new LinkedHashMap<>();
        boolean changed = false;
        for (String field : properties.getPriceFields()) {
            Object before = previous.get(field);
            Object after = next.get(field);
            previousPrices.put(field, before);
            if (!samePrice(before, after)) {
                changed = true;
            }
        }
        if (!changed) {
            return;
        }
        jdbc.update(
            """
                INSERT INTO listing_price_history (identity_key, previous_prices_json, recorded_at)
                VALUES (:identityKey, :previousPricesJson, :recordedAt)
                """,
            new MapSqlParameterSource()
                .addValue("identityKey", identityKey)
                .addValue("previousPricesJson", writeJson(previousPrices))
                .addValue("recordedAt", toTimestamp(recordedAt))
        );
    }

    private boolean samePrice(Object before, Object after) {
        if (before == null || after == null) {
            return before == after;
        }
        try {
            return new BigDecimal(before.toString()).compareTo(new BigDecimal(after.toString())) == 0;
        } catch (NumberFormatException e) {
            return before.toString().equals(after.toString());
        }
    }

    private RowMapper<StoredListing> storedListingRowMapper() {
        return (rs, rowNum) -> new StoredListing(
            rs.getString("identity_key"),
            rs.getString("site"),
            rs.getString("canonical_url"),
            readFields(rs.getString("fields_json")),
            rs.getString("content_hash"),
            toInstant(rs.getTimestamp("first_seen_at")),
            toInstant(rs.getTimestamp("last_seen_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private Map<String, Object> readFields(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, FIELD_MAP);
            return parsed == null ? Map.of() : parsed;
        } catch (JsonProcessingException e) {
            log.warn("Unreadable fields_json, treating as empty", e);
            return Map.of();
        }
    }

    private String writeJson(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields == null ? Map.of() : fields);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Listing fields are not serializable", e);
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upsert", e);
            return false;
        }
    }
}
