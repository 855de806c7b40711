package com.procrawl.listingsync.ingest.service;

import com.procrawl.listingsync.config.ListingSyncProperties;
import com.procrawl.listingsync.ingest.model.RawListing;
import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.RejectedListing;
import com.procrawl.listingsync.ingest.model.RejectionReason;
import com.procrawl.listingsync.ingest.normalize.RecordNormalizer;
import com.procrawl.listingsync.ingest.persistence.InMemoryListingStore;
import com.procrawl.listingsync.ingest.persistence.SyncRunRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ListingSyncServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private SyncRunRepository syncRunRepository;

    private ExecutorService executor;
    private InMemoryListingStore store;
    private ListingSyncService service;

    @BeforeEach
    void setUp() {
        ListingSyncProperties properties = new ListingSyncProperties();
        ListingSyncProperties.Site apolar = new ListingSyncProperties.Site();
        apolar.setOrigin("https://www.apolar.com.br");
        properties.getSites().put("apolar", apolar);
        ListingSyncProperties.Site archived = new ListingSyncProperties.Site();
        archived.setOrigin("https://archived.example.com");
        archived.setEnabled(false);
        properties.getSites().put("archived", archived);

        executor = Executors.newFixedThreadPool(2);
        store = new InMemoryListingStore();
        service = new ListingSyncService(
            new SiteConfigRegistry(properties),
            new RecordNormalizer(),
            new ListingSynchronizer(new KeyLocks(8), executor, CLOCK),
            store,
            syncRunRepository,
            executor,
            CLOCK
        );
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void syncsBatchAndRecordsCompletedRun() {
        when(syncRunRepository.insertSyncRun(eq("apolar"), any(Instant.class), eq(3))).thenReturn(7L);

        ReconciliationReport report = service.sync("apolar", List.of(
            raw("/imovel/1"),
            new RawListing(Map.of("title", "sem link")),
            raw("https://www.apolar.com.br/imovel/2")
        ));

        assertThat(report.received()).isEqualTo(3);
        assertThat(report.inserted()).isEqualTo(2);
        assertThat(report.rejected()).isEqualTo(1);
        assertThat(report.rejections()).extracting(RejectedListing::index).containsExactly(1);
        assertThat(report.rejections().get(0).reason()).isEqualTo(RejectionReason.INVALID_PRIMARY_URL);
        assertThat(store.rows()).containsOnlyKeys(
            "https://www.apolar.com.br/imovel/1",
            "https://www.apolar.com.br/imovel/2"
        );
        verify(syncRunRepository).completeSyncRun(eq(7L), any(Instant.class), eq("COMPLETED"), eq(report), isNull());
    }

    @Test
    void nullRecordsAreRejectedNotFatal() {
        when(syncRunRepository.insertSyncRun(anyString(), any(Instant.class), anyInt())).thenReturn(1L);

        ReconciliationReport report = service.sync("apolar", Arrays.asList(null, raw("/imovel/3")));

        assertThat(report.inserted()).isEqualTo(1);
        assertThat(report.rejections()).singleElement()
            .satisfies(rejection -> assertThat(rejection.index()).isZero());
    }

    @Test
    void storeFailureMarksRunFailedAndKeepsRejections() {
        when(syncRunRepository.insertSyncRun(anyString(), any(Instant.class), anyInt())).thenReturn(9L);
        store.failWritesFor("https://www.apolar.com.br/imovel/1");

        SyncIncompleteException failure = catchThrowableOfType(
            () -> service.sync("apolar", List.of(raw("/imovel/1"), new RawListing(Map.of()))),
            SyncIncompleteException.class
        );

        assertThat(failure.getPendingKeys()).containsExactly("https://www.apolar.com.br/imovel/1");
        assertThat(failure.getPartialReport().received()).isEqualTo(2);
        assertThat(failure.getPartialReport().rejected()).isEqualTo(1);
        ArgumentCaptor<String> status = ArgumentCaptor.forClass(String.class);
        verify(syncRunRepository).completeSyncRun(eq(9L), any(Instant.class), status.capture(), any(), anyString());
        assertThat(status.getValue()).isEqualTo("FAILED");
    }

    @Test
    void runBookkeepingFailureDoesNotFailTheSync() {
        when(syncRunRepository.insertSyncRun(anyString(), any(Instant.class), anyInt()))
            .thenThrow(new DataAccessResourceFailureException("sync_runs unavailable"));

        ReconciliationReport report = service.sync("apolar", List.of(raw("/imovel/4")));

        assertThat(report.inserted()).isEqualTo(1);
        verify(syncRunRepository, never()).completeSyncRun(anyLong(), any(), anyString(), any(), any());
    }

    @Test
    void unknownAndDisabledSitesAreRefusedBeforeAnyWork() {
        assertThatThrownBy(() -> service.sync("nowhere", List.of(raw("/imovel/1"))))
            .isInstanceOf(UnknownSiteException.class);
        assertThatThrownBy(() -> service.sync("archived", List.of(raw("/imovel/1"))))
            .isInstanceOf(SiteDisabledException.class);
        assertThat(store.rows()).isEmpty();
        verify(syncRunRepository, never()).insertSyncRun(anyString(), any(), anyInt());
    }

    private static RawListing raw(String url) {
        return new RawListing(Map.of("property_url", url, "title", "Apartamento"));
    }
}
