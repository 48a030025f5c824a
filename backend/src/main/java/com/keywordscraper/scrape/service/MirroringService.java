package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.MirrorResult;
import com.keywordscraper.scrape.source.ContentSourceException;
import com.keywordscraper.scrape.source.VideoDownloader;
import com.keywordscraper.scrape.storage.ObjectStorageService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

/**
 * Copies discovered content into object storage. Documents and images are fetched
 * from their source URL; videos are downloaded to a temporary file first.
 */
@Service
public class MirroringService {
    private static final Logger log = LoggerFactory.getLogger(MirroringService.class);

    public static final String ERROR_DOWNLOAD_FAILED = "download_failed";

    private final ObjectStorageService storage;
    private final VideoDownloader videoDownloader;

    public MirroringService(ObjectStorageService storage, VideoDownloader videoDownloader) {
        this.storage = storage;
        this.videoDownloader = videoDownloader;
    }

    public boolean isAvailable() {
        return storage.isAvailable();
    }

    public MirrorResult mirror(long itemId, String url, ContentType contentType, String keyword, String taskId) {
        if (!storage.isAvailable()) {
            return MirrorResult.failed("storage_unavailable", "object storage is not configured");
        }
        MirrorResult result;
        if (contentType == ContentType.VIDEO) {
            result = mirrorVideo(itemId, url, keyword, taskId);
        } else {
            result = storage.uploadFromUrl(url, keyword, contentType, taskId, itemId);
        }
        if (result.isStored()) {
            log.debug("Mirrored {} item {} to {}", contentType.key(), itemId, result.storageKey());
        } else {
            log.warn(
                "Mirroring {} item {} failed ({}): {}",
                contentType.key(),
                itemId,
                result.errorCode(),
                result.errorMessage()
            );
        }
        return result;
    }

    private MirrorResult mirrorVideo(long itemId, String url, String keyword, String taskId) {
        Path file = null;
        try {
            file = videoDownloader.download(url);
            return storage.uploadFile(file, url, keyword, ContentType.VIDEO, taskId, itemId);
        } catch (ContentSourceException e) {
            return MirrorResult.failed(ERROR_DOWNLOAD_FAILED, e.getErrorCode() + ": " + e.getMessage());
        } finally {
            videoDownloader.cleanup(file);
        }
    }

    /**
     * Removes an object written during a keyword whose database changes were rolled back.
     */
    public void discard(String storageKey) {
        if (!storage.delete(storageKey)) {
            log.warn("Could not remove orphaned object {}", storageKey);
        }
    }
}
