package com.keywordscraper.scrape.model;

import java.util.List;

public record ItemPageResponse(List<ScrapedItem> items, long total, int limit, int offset) {}
