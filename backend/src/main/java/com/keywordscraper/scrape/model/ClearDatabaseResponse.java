package com.keywordscraper.scrape.model;

import java.util.List;

public record ClearDatabaseResponse(int deletedCount, List<String> cancelledTaskIds, String message) {}
