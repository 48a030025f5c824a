package com.keywordscraper.scrape.model;

import java.util.List;

public record SourceFilesResponse(String taskId, List<String> sourceFiles) {}
