package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.KeywordBatch;
import com.keywordscraper.scrape.model.ResumePlan;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Works out which keywords of an upload still need scraping. A keyword counts as
 * already scraped when an item exists with the same keyword and source file.
 */
@Service
public class ResumePlanner {
    private static final Logger log = LoggerFactory.getLogger(ResumePlanner.class);

    private final ScrapeItemJdbcRepository repository;

    public ResumePlanner(ScrapeItemJdbcRepository repository) {
        this.repository = repository;
    }

    public ResumePlan plan(KeywordBatch batch) {
        List<String> keywords = batch.keywords();
        Set<String> allowed = new LinkedHashSet<>();
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank()) {
                allowed.add(keyword);
            }
        }

        Map<String, List<String>> keywordsByFile = new LinkedHashMap<>();
        for (String keyword : allowed) {
            String sourceFile = batch.keywordToSourceFile().get(keyword);
            if (sourceFile == null) {
                continue;
            }
            keywordsByFile.computeIfAbsent(sourceFile, ignored -> new ArrayList<>()).add(keyword);
        }
        Set<String> alreadyScraped = new LinkedHashSet<>();
        for (Map.Entry<String, List<String>> entry : keywordsByFile.entrySet()) {
            alreadyScraped.addAll(repository.findKeywordsWithItemsForSourceFile(entry.getKey(), entry.getValue()));
        }

        List<String> toProcess = new ArrayList<>();
        for (String keyword : keywords) {
            if (!alreadyScraped.contains(keyword)) {
                toProcess.add(keyword);
            }
        }

        boolean resumable = !alreadyScraped.isEmpty();
        int newCount = toProcess.size();
        int skippedCount = resumable ? keywords.size() - newCount : 0;
        boolean allScraped = resumable && newCount == 0;
        if (resumable) {
            log.info(
                "Resuming upload: {} keywords already scraped, {} new of {}",
                alreadyScraped.size(),
                newCount,
                keywords.size()
            );
        }
        return new ResumePlan(toProcess, allowed, alreadyScraped, resumable, newCount, skippedCount, allScraped);
    }
}
