package com.procrawl.listingsync.ingest.persistence;

import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.SyncRunView;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SyncRunRepositoryTest {

  @Autowired private SyncRunRepository repository;

  @Test
  void recordsRunLifecycle() {
    Instant startedAt = Instant.parse("2030-01-01T00:00:00Z");
    long id = repository.insertSyncRun("apolar", startedAt, 5);
    ReconciliationReport report = new ReconciliationReport("apolar", 5, 2, 1, 1, 1, 0, List.of());

    repository.completeSyncRun(id, startedAt.plusSeconds(3), "COMPLETED", report, null);

    SyncRunView latest = repository.findMostRecentSyncRun();
    assertThat(latest.syncRunId()).isEqualTo(id);
    assertThat(latest.status()).isEqualTo("COMPLETED");
    assertThat(latest.received()).isEqualTo(5);
    assertThat(latest.inserted()).isEqualTo(2);
    assertThat(latest.updated()).isEqualTo(1);
    assertThat(latest.unchanged()).isEqualTo(1);
    assertThat(latest.rejected()).isEqualTo(1);
    assertThat(latest.finishedAt()).isEqualTo(startedAt.plusSeconds(3));
  }

  @Test
  void longErrorMessagesAreTruncated() {
    Instant startedAt = Instant.parse("2030-02-01T00:00:00Z");
    long id = repository.insertSyncRun("apolar", startedAt, 1);

    repository.completeSyncRun(id, startedAt.plusSeconds(1), "FAILED", null, "x".repeat(5000));

    SyncRunView latest = repository.findMostRecentSyncRun();
    assertThat(latest.status()).isEqualTo("FAILED");
    assertThat(latest.errorMessage()).hasSize(2000);
  }
}
