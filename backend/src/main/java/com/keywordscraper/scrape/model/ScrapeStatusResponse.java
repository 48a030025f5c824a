package com.keywordscraper.scrape.model;

import java.util.Map;

public record ScrapeStatusResponse(
    boolean dbConnectivity,
    boolean storageAvailable,
    Map<String, Long> itemCounts,
    Map<String, Long> tasksByStatus
) {}
