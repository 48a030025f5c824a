package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.source.ContentSourceRegistry;
import com.keywordscraper.scrape.storage.ObjectStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
public class ScrapeStartupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeStartupRunner.class);

    private final ScrapeItemJdbcRepository repository;
    private final ObjectStorageService storage;
    private final ContentSourceRegistry sourceRegistry;

    public ScrapeStartupRunner(
        ScrapeItemJdbcRepository repository,
        ObjectStorageService storage,
        ContentSourceRegistry sourceRegistry
    ) {
        this.repository = repository;
        this.storage = storage;
        this.sourceRegistry = sourceRegistry;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception e) {
            log.warn("Database unreachable at startup: {}", e.getMessage());
            dbConnected = false;
        }
        if (dbConnected) {
            log.info("Database reachable; {} scraped items stored", repository.countItems());
        }
        log.info(
            "Object storage {}; content sources: {}",
            storage.isAvailable() ? "available" : "not configured",
            sourceRegistry.supportedTypes()
        );
    }
}
