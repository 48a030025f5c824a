package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ContentType;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * URL filter for one keyword: the stored URLs per content type, loaded once, plus
 * every URL accepted so far for the keyword regardless of type. First seen wins.
 */
public final class DedupSession {
    private final Map<ContentType, Set<String>> known;
    private final Set<String> acceptedForKeyword = new HashSet<>();

    DedupSession(Map<ContentType, Set<String>> known) {
        this.known = new EnumMap<>(ContentType.class);
        this.known.putAll(known);
    }

    /**
     * Records {@code url} and returns true if it is not stored for this content type
     * and has not been accepted earlier for the keyword.
     */
    public boolean accept(ContentType contentType, String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        Set<String> stored = known.get(contentType);
        if (stored != null && stored.contains(url)) {
            return false;
        }
        return acceptedForKeyword.add(url);
    }
}
