package com.procrawl.listingsync.ingest.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.procrawl.listingsync.config.ListingSyncProperties;
import com.procrawl.listingsync.ingest.model.RawListing;
import com.procrawl.listingsync.ingest.model.ReconciliationReport;
import com.procrawl.listingsync.ingest.model.RejectedListing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Imports one extraction file at startup when {@code listing-sync.cli.run} is set. Without an
 * explicit site, the site is the file name up to the first underscore
 * ({@code apolar_2024-05-01.json} syncs into {@code apolar}).
 */
@Component
public class SyncCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SyncCliRunner.class);
    private static final TypeReference<List<RawListing>> RAW_LISTINGS = new TypeReference<>() {
    };

    private final ListingSyncProperties properties;
    private final ListingSyncService listingSyncService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public SyncCliRunner(
        ListingSyncProperties properties,
        ListingSyncService listingSyncService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.listingSyncService = listingSyncService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        ListingSyncProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }
        if (cli.getFile() == null || cli.getFile().isBlank()) {
            throw new IllegalStateException("listing-sync.cli.file is required when listing-sync.cli.run is set");
        }

        Path file = Path.of(cli.getFile().trim());
        String site = cli.getSite() == null || cli.getSite().isBlank() ? inferSite(file) : cli.getSite().trim();
        List<RawListing> listings = readListings(file);
        log.info("Importing {} records from {} into site {}", listings.size(), file, site);

        int exitCode = 0;
        try {
            ReconciliationReport report = listingSyncService.sync(site, listings);
            log.info(
                "Import finished: inserted={}, updated={}, unchanged={}, rejected={}",
                report.inserted(),
                report.updated(),
                report.unchanged(),
                report.rejected()
            );
            for (RejectedListing rejection : report.rejections()) {
                log.info("Rejected record {}: {} ({})", rejection.index(), rejection.reason(), rejection.detail());
            }
        } catch (SyncIncompleteException e) {
            log.error("Import aborted with {} pending keys: {}", e.getPendingKeys().size(), e.getMessage(), e);
            exitCode = 1;
        }

        if (cli.isExitAfterRun()) {
            int finalExitCode = exitCode;
            System.exit(SpringApplication.exit(applicationContext, () -> finalExitCode));
        }
    }

    static String inferSite(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        int underscore = name.indexOf('_');
        String site = underscore >= 0 ? name.substring(0, underscore) : name;
        if (site.isBlank()) {
            throw new IllegalStateException("Cannot infer site from file name: " + file);
        }
        return site;
    }

    private List<RawListing> readListings(Path file) {
        try {
            List<RawListing> listings = objectMapper.readValue(Files.readAllBytes(file), RAW_LISTINGS);
            return listings == null ? List.of() : listings;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read extraction file " + file, e);
        }
    }
}
