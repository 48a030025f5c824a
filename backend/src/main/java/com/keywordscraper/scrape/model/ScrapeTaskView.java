package com.keywordscraper.scrape.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

public record ScrapeTaskView(
    String taskId,
    TaskStatus status,
    String errorMessage,
    String keyword,
    int currentKeywordIndex,
    int totalKeywords,
    int documentCount,
    int imageCount,
    int videoCount,
    List<String> keywordsToProcess,
    Set<String> allowedKeywords,
    List<String> files,
    Set<ContentType> enabledTypes,
    boolean resumableMode,
    int newKeywordCount,
    int skippedKeywordCount,
    boolean allKeywordsScraped,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
    public static ScrapeTaskView from(ScrapeTask task) {
        return new ScrapeTaskView(
            task.id(),
            task.status(),
            task.errorMessage(),
            task.currentKeyword(),
            task.currentIndex(),
            task.totalKeywords(),
            task.counts().document(),
            task.counts().image(),
            task.counts().video(),
            task.keywordsToProcess(),
            task.allowedKeywords(),
            task.files(),
            task.enabledTypes(),
            task.resumableMode(),
            task.newKeywordCount(),
            task.skippedKeywordCount(),
            task.allKeywordsScraped(),
            task.createdAt(),
            task.updatedAt(),
            task.finishedAt()
        );
    }
}
