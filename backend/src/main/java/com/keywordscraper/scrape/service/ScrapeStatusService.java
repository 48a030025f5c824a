package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ClearDatabaseResponse;
import com.keywordscraper.scrape.model.ScrapeStatusResponse;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.storage.ObjectStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class ScrapeStatusService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeStatusService.class);

    private final ScrapeItemJdbcRepository repository;
    private final TaskRegistry registry;
    private final ObjectStorageService storage;

    public ScrapeStatusService(ScrapeItemJdbcRepository repository, TaskRegistry registry, ObjectStorageService storage) {
        this.repository = repository;
        this.registry = registry;
        this.storage = storage;
    }

    public ScrapeStatusResponse getStatus() {
        boolean dbConnected;
        try {
            dbConnected = repository.isDbReachable();
        } catch (Exception ignored) {
            dbConnected = false;
        }
        Map<String, Long> itemCounts = dbConnected ? repository.countByContentType() : new LinkedHashMap<>();
        return new ScrapeStatusResponse(dbConnected, storage.isAvailable(), itemCounts, registry.countByStatus());
    }

    /**
     * Stops every processing task, then deletes all stored items. Mirrored objects
     * in storage are left in place.
     */
    public ClearDatabaseResponse clearDatabase() {
        List<String> cancelled = registry.cancelAllProcessing(null);
        if (!cancelled.isEmpty()) {
            log.info("Clearing database: cancellation requested for tasks {}", cancelled);
        }
        int deleted = repository.deleteAllItems();
        String message = deleted > 0
            ? "Successfully deleted " + deleted + " items from database"
            : "Database is already empty";
        return new ClearDatabaseResponse(deleted, cancelled, message);
    }
}
