package com.keywordscraper.scrape.model;

public record ContentCounts(int document, int image, int video) {
    public static final ContentCounts ZERO = new ContentCounts(0, 0, 0);

    public ContentCounts {
        if (document < 0 || image < 0 || video < 0) {
            throw new IllegalArgumentException("counts must be non-negative");
        }
    }

    public ContentCounts increment(ContentType type) {
        switch (type) {
            case DOCUMENT:
                return new ContentCounts(document + 1, image, video);
            case IMAGE:
                return new ContentCounts(document, image + 1, video);
            case VIDEO:
                return new ContentCounts(document, image, video + 1);
            default:
                throw new IllegalArgumentException("Unknown content type: " + type);
        }
    }

    public ContentCounts plus(ContentCounts other) {
        if (other == null) {
            return this;
        }
        return new ContentCounts(document + other.document, image + other.image, video + other.video);
    }

    public int total() {
        return document + image + video;
    }
}
