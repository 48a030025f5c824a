package com.keywordscraper.scrape.model;

import java.util.List;
import java.util.Set;

public record ResumePlan(
    List<String> keywordsToProcess,
    Set<String> allowedKeywords,
    Set<String> alreadyScrapedKeywords,
    boolean resumableMode,
    int newKeywordCount,
    int skippedKeywordCount,
    boolean allKeywordsScraped
) {}
