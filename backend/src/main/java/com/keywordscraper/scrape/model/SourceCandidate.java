package com.keywordscraper.scrape.model;

public record SourceCandidate(
    String url,
    String title,
    String description,
    String thumbnailUrl,
    Integer durationSeconds,
    Long fileSize
) {
    public static SourceCandidate of(String url, String title, String description) {
        return new SourceCandidate(url, title, description, null, null, null);
    }
}
