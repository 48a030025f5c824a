package com.keywordscraper.scrape.service;

import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.model.ContentCounts;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.KeywordScrapeResult;
import com.keywordscraper.scrape.model.MirrorResult;
import com.keywordscraper.scrape.model.NewScrapedItem;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.SourceCandidate;
import com.keywordscraper.scrape.model.SourceSearchResult;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.source.ContentSourceRegistry;
import com.keywordscraper.scrape.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scrapes one keyword across the enabled content types. Each accepted item is
 * committed on its own before it is mirrored, so a later failure never removes
 * items that were already stored. Searching and mirroring run outside any
 * transaction.
 */
@Service
public class KeywordScrapeService {
    private static final Logger log = LoggerFactory.getLogger(KeywordScrapeService.class);
    private static final int MAX_URL_CHARS = 4096;

    private final ScrapeItemJdbcRepository repository;
    private final UrlDeduplicator deduplicator;
    private final MirroringService mirroringService;
    private final ScraperProperties properties;
    private final TransactionTemplate transactionTemplate;

    public KeywordScrapeService(
        ScrapeItemJdbcRepository repository,
        UrlDeduplicator deduplicator,
        MirroringService mirroringService,
        ScraperProperties properties,
        TransactionTemplate transactionTemplate
    ) {
        this.repository = repository;
        this.deduplicator = deduplicator;
        this.mirroringService = mirroringService;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
    }

    public KeywordScrapeResult scrapeKeyword(ScrapeTask task, String keyword, ContentSourceRegistry.SourceRun sources) {
        if (!task.isKeywordAllowed(keyword)) {
            log.warn("Task {} rejected keyword '{}': not in the allowed keyword list", task.id(), keyword);
            return KeywordScrapeResult.skipped(keyword);
        }
        DedupSession dedup = deduplicator.open(task.enabledTypes());
        String sourceFile = task.sourceFileFor(keyword);
        ContentCounts added = ContentCounts.ZERO;
        Map<ContentType, String> sourceErrors = new EnumMap<>(ContentType.class);
        List<String> storedKeys = new ArrayList<>();
        boolean mirror = mirroringService.isAvailable();

        for (ContentType type : ContentType.PROCESSING_ORDER) {
            if (!task.enabledTypes().contains(type)) {
                continue;
            }
            int acceptCap = acceptCap(type);
            SourceSearchResult result = sources.search(type, keyword, searchCap(type));
            if (!result.isSuccessful()) {
                sourceErrors.put(type, result.errorCode());
                continue;
            }
            int accepted = 0;
            for (SourceCandidate candidate : result.candidates()) {
                if (accepted >= acceptCap) {
                    break;
                }
                String url = candidate.url();
                if (url == null || url.isBlank() || url.length() > MAX_URL_CHARS) {
                    continue;
                }
                if (!dedup.accept(type, url)) {
                    log.debug("Skipping duplicate {} url {}", type.key(), url);
                    continue;
                }
                NewScrapedItem item = new NewScrapedItem(
                    keyword,
                    url,
                    type,
                    candidate.title() == null ? "" : candidate.title(),
                    candidate.description() == null ? "" : candidate.description(),
                    candidate.fileSize(),
                    type == ContentType.VIDEO ? HashUtils.sha256Hex(url) : null,
                    task.id(),
                    sourceFile
                );
                Long itemId = transactionTemplate.execute(status -> repository.insertItem(item, Instant.now()));
                if (mirror && itemId != null) {
                    MirrorResult mirrored = mirroringService.mirror(itemId, url, type, keyword, task.id());
                    if (mirrored.isStored()) {
                        attachStorage(itemId, mirrored);
                        storedKeys.add(mirrored.storageKey());
                    }
                }
                accepted++;
                added = added.increment(type);
            }
            log.info("Keyword '{}' {}: {} accepted of {} found", keyword, type.key(), accepted, result.candidates().size());
        }
        return new KeywordScrapeResult(keyword, added, List.copyOf(storedKeys), sourceErrors);
    }

    private void attachStorage(long itemId, MirrorResult mirrored) {
        try {
            transactionTemplate.executeWithoutResult(
                status -> repository.attachStorage(itemId, mirrored.storageKey(), mirrored.publicUrl())
            );
        } catch (RuntimeException e) {
            // the item row stays; only the object it would have pointed at goes
            mirroringService.discard(mirrored.storageKey());
            throw e;
        }
    }

    int acceptCap(ContentType type) {
        ScraperProperties.Limits limits = properties.getLimits();
        return type == ContentType.DOCUMENT ? limits.getMaxDocumentResultsPerKeyword() : limits.getMaxResultsPerKeyword();
    }

    int searchCap(ContentType type) {
        ScraperProperties.Limits limits = properties.getLimits();
        if (type == ContentType.DOCUMENT) {
            return limits.getMaxDocumentResultsPerKeyword();
        }
        return limits.getMaxResultsPerKeyword() * limits.getSearchMultiplier();
    }
}
