package com.keywordscraper.scrape.storage;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.MirrorResult;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Durable object storage for mirrored content. Upload failures are reported through
 * {@link MirrorResult} rather than thrown.
 */
public interface ObjectStorageService {

    boolean isAvailable();

    /**
     * Fetches {@code sourceUrl} and stores the bytes. {@code itemId} may be null.
     */
    MirrorResult uploadFromUrl(String sourceUrl, String keyword, ContentType contentType, String taskId, Long itemId);

    MirrorResult uploadFile(Path file, String sourceUrl, String keyword, ContentType contentType, String taskId, Long itemId);

    /**
     * Public URL when a public base is configured, otherwise a presigned GET URL.
     * Returns null when storage is unavailable.
     */
    String downloadUrl(String storageKey, Duration expiry);

    /**
     * Best-effort removal. Returns false instead of throwing.
     */
    boolean delete(String storageKey);
}
