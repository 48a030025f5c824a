package com.keywordscraper.scrape.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable snapshot of one scraping run. Every state transition produces a new
 * instance; the {@link com.keywordscraper.scrape.service.TaskRegistry} swaps
 * snapshots atomically so pollers never observe a half-applied update.
 */
public record ScrapeTask(
    String id,
    List<String> keywordsToProcess,
    Set<String> allowedKeywords,
    Map<String, String> keywordToSourceFile,
    List<String> files,
    Set<ContentType> enabledTypes,
    TaskStatus status,
    String errorMessage,
    ContentCounts counts,
    String currentKeyword,
    int currentIndex,
    int totalKeywords,
    boolean resumableMode,
    int newKeywordCount,
    int skippedKeywordCount,
    boolean allKeywordsScraped,
    Instant createdAt,
    Instant updatedAt,
    Instant finishedAt
) {
    public ScrapeTask {
        keywordsToProcess = keywordsToProcess == null ? List.of() : List.copyOf(keywordsToProcess);
        allowedKeywords = allowedKeywords == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(allowedKeywords));
        keywordToSourceFile = keywordToSourceFile == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(keywordToSourceFile));
        files = files == null ? List.of() : List.copyOf(files);
        enabledTypes = enabledTypes == null || enabledTypes.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(enabledTypes));
        counts = counts == null ? ContentCounts.ZERO : counts;
        status = status == null ? TaskStatus.PROCESSING : status;
    }

    public static ScrapeTask create(
        String id,
        ResumePlan plan,
        Map<String, String> keywordToSourceFile,
        List<String> files,
        Set<ContentType> enabledTypes,
        Instant now
    ) {
        return new ScrapeTask(
            id,
            plan.keywordsToProcess(),
            plan.allowedKeywords(),
            keywordToSourceFile,
            files,
            enabledTypes,
            TaskStatus.PROCESSING,
            null,
            ContentCounts.ZERO,
            "",
            0,
            plan.keywordsToProcess().size(),
            plan.resumableMode(),
            plan.newKeywordCount(),
            plan.skippedKeywordCount(),
            plan.allKeywordsScraped(),
            now,
            now,
            null
        );
    }

    public boolean isKeywordAllowed(String keyword) {
        return keyword != null && allowedKeywords.contains(keyword);
    }

    public String sourceFileFor(String keyword) {
        return keywordToSourceFile.getOrDefault(keyword, "unknown");
    }

    public ScrapeTask withProgress(String keyword, int index, Instant now) {
        return new ScrapeTask(
            id, keywordsToProcess, allowedKeywords, keywordToSourceFile, files, enabledTypes,
            status, errorMessage, counts, keyword, index, totalKeywords,
            resumableMode, newKeywordCount, skippedKeywordCount, allKeywordsScraped,
            createdAt, now, finishedAt
        );
    }

    public ScrapeTask withAddedCounts(ContentCounts added, Instant now) {
        return new ScrapeTask(
            id, keywordsToProcess, allowedKeywords, keywordToSourceFile, files, enabledTypes,
            status, errorMessage, counts.plus(added), currentKeyword, currentIndex, totalKeywords,
            resumableMode, newKeywordCount, skippedKeywordCount, allKeywordsScraped,
            createdAt, now, finishedAt
        );
    }

    public ScrapeTask withTerminalStatus(TaskStatus terminal, String message, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        return new ScrapeTask(
            id, keywordsToProcess, allowedKeywords, keywordToSourceFile, files, enabledTypes,
            terminal, message, counts, currentKeyword, currentIndex, totalKeywords,
            resumableMode, newKeywordCount, skippedKeywordCount, allKeywordsScraped,
            createdAt, now, now
        );
    }
}
