package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

@Service
public class UrlDeduplicator {
    private final ScrapeItemJdbcRepository repository;

    public UrlDeduplicator(ScrapeItemJdbcRepository repository) {
        this.repository = repository;
    }

    /**
     * Loads every stored URL for the enabled content types, across all tasks.
     */
    public DedupSession open(Collection<ContentType> enabledTypes) {
        Map<ContentType, Set<String>> known = new EnumMap<>(ContentType.class);
        for (ContentType type : enabledTypes) {
            known.put(type, repository.findUrlsByContentType(type));
        }
        return new DedupSession(known);
    }
}
