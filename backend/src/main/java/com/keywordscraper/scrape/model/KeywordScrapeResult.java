package com.keywordscraper.scrape.model;

import java.util.List;
import java.util.Map;

public record KeywordScrapeResult(
    String keyword,
    ContentCounts added,
    List<String> storedKeys,
    Map<ContentType, String> sourceErrors
) {
    public static KeywordScrapeResult skipped(String keyword) {
        return new KeywordScrapeResult(keyword, ContentCounts.ZERO, List.of(), Map.of());
    }
}
