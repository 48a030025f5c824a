package com.keywordscraper.scrape.model;

import java.util.List;
import java.util.Map;

/**
 * Keywords extracted from one submission: deduplicated in order of first
 * appearance, with the file each keyword was attributed to.
 */
public record KeywordBatch(
    List<String> keywords,
    Map<String, String> keywordToSourceFile,
    List<String> files
) {}
