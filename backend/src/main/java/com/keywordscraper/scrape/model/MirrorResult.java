package com.keywordscraper.scrape.model;

public record MirrorResult(
    String publicUrl,
    String storageKey,
    long bytes,
    String errorCode,
    String errorMessage
) {
    public static MirrorResult stored(String publicUrl, String storageKey, long bytes) {
        return new MirrorResult(publicUrl, storageKey, bytes, null, null);
    }

    public static MirrorResult failed(String errorCode, String errorMessage) {
        return new MirrorResult(null, null, 0, errorCode, errorMessage);
    }

    public boolean isStored() {
        return errorCode == null && storageKey != null;
    }
}
