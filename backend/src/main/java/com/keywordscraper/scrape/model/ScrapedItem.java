package com.keywordscraper.scrape.model;

import java.time.Instant;

public record ScrapedItem(
    long id,
    String keyword,
    String url,
    ContentType contentType,
    String title,
    String description,
    Long fileSize,
    String contentHash,
    String storageKey,
    String storageUrl,
    String taskId,
    String sourceFile,
    Instant createdAt
) {
    public boolean hasStorageKey() {
        return storageKey != null && !storageKey.isBlank();
    }

    public ScrapedItem withStorageUrl(String url) {
        return new ScrapedItem(
            id, keyword, this.url, contentType, title, description, fileSize, contentHash,
            storageKey, url, taskId, sourceFile, createdAt
        );
    }
}
