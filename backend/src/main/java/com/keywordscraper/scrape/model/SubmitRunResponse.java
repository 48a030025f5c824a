package com.keywordscraper.scrape.model;

public record SubmitRunResponse(
    String taskId,
    int totalKeywords,
    int filesProcessed,
    boolean resumableMode,
    int newKeywordCount,
    int skippedKeywordCount,
    boolean allKeywordsScraped
) {}
