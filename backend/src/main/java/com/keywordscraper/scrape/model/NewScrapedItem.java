package com.keywordscraper.scrape.model;

public record NewScrapedItem(
    String keyword,
    String url,
    ContentType contentType,
    String title,
    String description,
    Long fileSize,
    String contentHash,
    String taskId,
    String sourceFile
) {}
