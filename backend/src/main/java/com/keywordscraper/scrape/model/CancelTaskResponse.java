package com.keywordscraper.scrape.model;

public record CancelTaskResponse(String taskId, boolean cancelRequested, TaskStatus status, String message) {}
