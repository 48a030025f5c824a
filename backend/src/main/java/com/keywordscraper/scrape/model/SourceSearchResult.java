package com.keywordscraper.scrape.model;

import java.util.List;

public record SourceSearchResult(
    ContentType contentType,
    String keyword,
    List<SourceCandidate> candidates,
    String errorCode,
    String errorMessage
) {
    public SourceSearchResult {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static SourceSearchResult ok(ContentType contentType, String keyword, List<SourceCandidate> candidates) {
        return new SourceSearchResult(contentType, keyword, candidates, null, null);
    }

    public static SourceSearchResult failed(ContentType contentType, String keyword, String errorCode, String errorMessage) {
        return new SourceSearchResult(contentType, keyword, List.of(), errorCode, errorMessage);
    }

    public boolean isSuccessful() {
        return errorCode == null;
    }
}
