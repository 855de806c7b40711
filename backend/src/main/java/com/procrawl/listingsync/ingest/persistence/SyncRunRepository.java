package com.procrawl.listingsync.ingest.persistence;

import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.SyncRunView;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class SyncRunRepository {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final NamedParameterJdbcTemplate jdbc;

    public SyncRunRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public long insertSyncRun(String site, Instant startedAt, int received) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("site", site)
            .addValue("status", "RUNNING")
            .addValue("startedAt", toTimestamp(startedAt))
            .addValue("received", received);

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO sync_runs (site, status, started_at, records_received)
                VALUES (:site, :status, :startedAt, :received)
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        Long id = key == null ? null : key.longValue();
        if (id == null) {
            id = jdbc.queryForObject(
                """
                    SELECT id
                    FROM sync_runs
                    WHERE site = :site
                      AND started_at = :startedAt
                    ORDER BY id DESC
                    LIMIT 1
                    """,
                params,
                Long.class
            );
            if (id == null) {
                throw new IllegalStateException("Failed to insert sync run");
            }
        }
        return id;
    }

    public void completeSyncRun(
        long syncRunId,
        Instant finishedAt,
        String status,
        ReconciliationReport report,
        String errorMessage
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("syncRunId", syncRunId)
            .addValue("finishedAt", toTimestamp(finishedAt))
            .addValue("status", status)
            .addValue("inserted", report == null ? 0 : report.inserted())
            .addValue("updated", report == null ? 0 : report.updated())
            .addValue("unchanged", report == null ? 0 : report.unchanged())
            .addValue("rejected", report == null ? 0 : report.rejected())
            .addValue("errorMessage", truncate(errorMessage));
        jdbc.update(
            """
                UPDATE sync_runs
                SET finished_at = :finishedAt,
                    status = :status,
                    records_inserted = :inserted,
                    records_updated = :updated,
                    records_unchanged = :unchanged,
                    records_rejected = :rejected,
                    error_message = :errorMessage
                WHERE id = :syncRunId
                """,
            params
        );
    }

    public List<SyncRunView> findRecentSyncRuns(int limit) {
        return jdbc.query(
            """
                SELECT id, site, status, started_at, finished_at, records_received, records_inserted,
                       records_updated, records_unchanged, records_rejected, error_message
                FROM sync_runs
                ORDER BY started_at DESC, id DESC
                LIMIT :limit
                """,
            new MapSqlParameterSource().addValue("limit", Math.max(1, limit)),
            syncRunRowMapper()
        );
    }

    public SyncRunView findMostRecentSyncRun() {
        List<SyncRunView> runs = findRecentSyncRuns(1);
        return runs.isEmpty() ? null : runs.get(0);
    }

    private RowMapper<SyncRunView> syncRunRowMapper() {
        return (rs, rowNum) -> new SyncRunView(
            rs.getLong("id"),
            rs.getString("site"),
            rs.getString("status"),
            rs.getTimestamp("started_at").toInstant(),
            rs.getTimestamp("finished_at") == null ? null : rs.getTimestamp("finished_at").toInstant(),
            rs.getInt("records_received"),
            rs.getInt("records_inserted"),
            rs.getInt("records_updated"),
            rs.getInt("records_unchanged"),
            rs.getInt("records_rejected"),
            rs.getString("error_message")
        );
    }

    private String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }
}
