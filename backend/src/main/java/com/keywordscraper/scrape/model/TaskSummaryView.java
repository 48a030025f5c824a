package com.keywordscraper.scrape.model;

import java.time.Instant;
import java.util.List;

public record TaskSummaryView(
    String taskId,
    TaskStatus status,
    int totalKeywords,
    int currentKeywordIndex,
    List<String> files,
    int documentCount,
    int imageCount,
    int videoCount,
    Instant createdAt
) {
    public static TaskSummaryView from(ScrapeTask task) {
        return new TaskSummaryView(
            task.id(),
            task.status(),
            task.totalKeywords(),
            task.currentIndex(),
            task.files(),
            task.counts().document(),
            task.counts().image(),
            task.counts().video(),
            task.createdAt()
        );
    }
}
