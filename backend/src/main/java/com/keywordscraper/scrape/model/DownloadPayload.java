package com.keywordscraper.scrape.model;

public record DownloadPayload(String filename, String mediaType, byte[] content) {}
