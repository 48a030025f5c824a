package com.keywordscraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public enum ContentType {
    DOCUMENT("document", "documents"),
    IMAGE("image", "images"),
    VIDEO("video", "videos");

    /**
     * Order in which content types are scraped for a single keyword.
     */
    public static final List<ContentType> PROCESSING_ORDER = List.of(VIDEO, IMAGE, DOCUMENT);

    private final String key;
    private final String storageDirectory;

    ContentType(String key, String storageDirectory) {
        this.key = key;
        this.storageDirectory = storageDirectory;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public String storageDirectory() {
        return storageDirectory;
    }

    /**
     * Parses a request parameter. Accepts the canonical keys plus the legacy
     * {@code pdf} and {@code youtube} aliases.
     *
     * @throws IllegalArgumentException for anything else
     */
    public static ContentType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("content type is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "document":
            case "pdf":
                return DOCUMENT;
            case "image":
                return IMAGE;
            case "video":
            case "youtube":
                return VIDEO;
            default:
                throw new IllegalArgumentException("Unsupported content type: " + value);
        }
    }

    public static Set<ContentType> enabled(boolean document, boolean image, boolean video) {
        Set<ContentType> out = EnumSet.noneOf(ContentType.class);
        if (document) {
            out.add(DOCUMENT);
        }
        if (image) {
            out.add(IMAGE);
        }
        if (video) {
            out.add(VIDEO);
        }
        return out;
    }
}
