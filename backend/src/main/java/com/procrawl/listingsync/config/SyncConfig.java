package com.procrawl.listingsync.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.procrawl.listingsync.ingest.service.KeyLocks;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SyncConfig {

    @Bean(name = "normalizeExecutor", destroyMethod = "shutdown")
    public ExecutorService normalizeExecutor(ListingSyncProperties properties) {
        return Executors.newFixedThreadPool(properties.getNormalizeConcurrency());
    }

    @Bean(name = "syncExecutor", destroyMethod = "shutdown")
    public ExecutorService syncExecutor(ListingSyncProperties properties) {
        return Executors.newFixedThreadPool(properties.getSyncConcurrency());
    }

    @Bean
    public KeyLocks keyLocks(ListingSyncProperties properties) {
        return new KeyLocks(properties.getLockStripes());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
