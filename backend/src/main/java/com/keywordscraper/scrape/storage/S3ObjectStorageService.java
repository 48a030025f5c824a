package com.keywordscraper.scrape.storage;

import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.http.ScrapeHttpClient;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.HttpFetchResult;
import com.keywordscraper.scrape.model.MirrorResult;
import com.keywordscraper.scrape.util.MediaFiles;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * S3-compatible storage (Cloudflare R2, MinIO, AWS S3). Unavailable unless a bucket
 * and credentials are configured.
 */
@Service
public class S3ObjectStorageService implements ObjectStorageService {
    private static final Logger log = LoggerFactory.getLogger(S3ObjectStorageService.class);

    public static final String ERROR_UNAVAILABLE = "storage_unavailable";
    public static final String ERROR_FETCH_FAILED = "fetch_failed";
    public static final String ERROR_TOO_LARGE = "too_large";
    public static final String ERROR_UPLOAD_FAILED = "upload_failed";

    private static final String CACHE_CONTROL = "public, max-age=31536000";
    private static final int MAX_METADATA_CHARS = 1024;

    private final ScraperProperties properties;
    private final ScrapeHttpClient httpClient;
    private final S3Client s3;
    private final S3Presigner presigner;

    @Autowired
    public S3ObjectStorageService(ScraperProperties properties, ScrapeHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        S3Client client = null;
        S3Presigner signer = null;
        ScraperProperties.Storage storage = properties.getStorage();
        if (storage.isConfigured()) {
            try {
                client = buildClient(storage);
                signer = buildPresigner(storage);
                log.info("Object storage configured (bucket={}, endpoint={})", storage.getBucket(), storage.getEndpoint());
            } catch (RuntimeException e) {
                log.warn("Object storage configuration rejected; mirroring disabled", e);
                closeQuietly(client);
                client = null;
                signer = null;
            }
        } else {
            log.info("Object storage not configured; items keep their source URLs only");
        }
        this.s3 = client;
        this.presigner = signer;
    }

    S3ObjectStorageService(ScraperProperties properties, ScrapeHttpClient httpClient, S3Client s3, S3Presigner presigner) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.s3 = s3;
        this.presigner = presigner;
    }

    @Override
    public boolean isAvailable() {
        return s3 != null && presigner != null;
    }

    @Override
    public MirrorResult uploadFromUrl(String sourceUrl, String keyword, ContentType contentType, String taskId, Long itemId) {
        if (!isAvailable()) {
            return MirrorResult.failed(ERROR_UNAVAILABLE, "object storage is not configured");
        }
        long maxBytes = properties.getStorage().maxDownloadBytes();
        HttpFetchResult fetched = httpClient.get(sourceUrl, "*/*", maxBytes);
        if (ScrapeHttpClient.ERROR_BODY_TOO_LARGE.equals(fetched.errorCode())) {
            return MirrorResult.failed(ERROR_TOO_LARGE, fetched.errorMessage());
        }
        if (!fetched.isSuccessful() || fetched.bodyBytes() == null) {
            String reason = fetched.errorCode() != null ? fetched.errorCode() : "http_" + fetched.statusCode();
            return MirrorResult.failed(ERROR_FETCH_FAILED, "fetch " + reason + " for " + sourceUrl);
        }
        byte[] content = fetched.bodyBytes();
        return put(RequestBody.fromBytes(content), content.length, sourceUrl, keyword, contentType, taskId, itemId);
    }

    @Override
    public MirrorResult uploadFile(Path file, String sourceUrl, String keyword, ContentType contentType, String taskId, Long itemId) {
        if (!isAvailable()) {
            return MirrorResult.failed(ERROR_UNAVAILABLE, "object storage is not configured");
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            return MirrorResult.failed(ERROR_FETCH_FAILED, "unable to read " + file + ": " + e.getMessage());
        }
        if (size > properties.getStorage().maxDownloadBytes()) {
            return MirrorResult.failed(
                ERROR_TOO_LARGE,
                "file of " + size + " bytes exceeds limit of " + properties.getStorage().maxDownloadBytes()
            );
        }
        return put(RequestBody.fromFile(file), size, sourceUrl, keyword, contentType, taskId, itemId);
    }

    private MirrorResult put(
        RequestBody body,
        long size,
        String sourceUrl,
        String keyword,
        ContentType contentType,
        String taskId,
        Long itemId
    ) {
        String extension = MediaFiles.extension(contentType, sourceUrl);
        String key = StorageKeys.objectKey(contentType, keyword, sourceUrl, itemId, extension);
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("original-url", metadataValue(sourceUrl));
        metadata.put("keyword", metadataValue(keyword));
        metadata.put("task-id", metadataValue(taskId));
        PutObjectRequest request = PutObjectRequest.builder()
            .bucket(properties.getStorage().getBucket())
            .key(key)
            .contentType(MediaFiles.mediaType(contentType, sourceUrl))
            .contentDisposition("attachment; filename=\"" + StorageKeys.filename(key) + "\"")
            .cacheControl(CACHE_CONTROL)
            .metadata(metadata)
            .build();
        try {
            s3.putObject(request, body);
        } catch (SdkException e) {
            log.warn("Upload of {} to {} failed: {}", sourceUrl, key, e.getMessage());
            return MirrorResult.failed(ERROR_UPLOAD_FAILED, e.getMessage());
        }
        return MirrorResult.stored(publicUrl(key), key, size);
    }

    @Override
    public String downloadUrl(String storageKey, Duration expiry) {
        if (!isAvailable() || storageKey == null || storageKey.isBlank()) {
            return null;
        }
        String publicUrl = publicUrl(storageKey);
        if (publicUrl != null) {
            return publicUrl;
        }
        GetObjectPresignRequest request = GetObjectPresignRequest.builder()
            .signatureDuration(expiry)
            .getObjectRequest(GetObjectRequest.builder()
                .bucket(properties.getStorage().getBucket())
                .key(storageKey)
                .build())
            .build();
        try {
            return presigner.presignGetObject(request).url().toString();
        } catch (SdkException e) {
            log.warn("Failed to presign {}: {}", storageKey, e.getMessage());
            return null;
        }
    }

    @Override
    public boolean delete(String storageKey) {
        if (!isAvailable() || storageKey == null || storageKey.isBlank()) {
            return false;
        }
        try {
            s3.deleteObject(DeleteObjectRequest.builder()
                .bucket(properties.getStorage().getBucket())
                .key(storageKey)
                .build());
            return true;
        } catch (SdkException e) {
            log.warn("Failed to delete {}: {}", storageKey, e.getMessage());
            return false;
        }
    }

    @PreDestroy
    public void shutdown() {
        closeQuietly(s3);
        if (presigner != null) {
            presigner.close();
        }
    }

    private String publicUrl(String key) {
        String base = properties.getStorage().getPublicUrl();
        if (base == null || base.isBlank()) {
            return null;
        }
        String trimmed = base.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed + "/" + key;
    }

    private String metadataValue(String value) {
        if (value == null) {
            return "";
        }
        String encoded = URLEncoder.encode(value, StandardCharsets.UTF_8);
        return encoded.length() > MAX_METADATA_CHARS ? encoded.substring(0, MAX_METADATA_CHARS) : encoded;
    }

    private static S3Client buildClient(ScraperProperties.Storage storage) {
        var builder = S3Client.builder()
            .region(Region.of(storage.getRegion()))
            .credentialsProvider(credentials(storage))
            .serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(storage.isPathStyleAccess())
                .build());
        if (storage.getEndpoint() != null && !storage.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.getEndpoint().trim()));
        }
        return builder.build();
    }

    private static S3Presigner buildPresigner(ScraperProperties.Storage storage) {
        var builder = S3Presigner.builder()
            .region(Region.of(storage.getRegion()))
            .credentialsProvider(credentials(storage))
            .serviceConfiguration(S3Configuration.builder()
                .pathStyleAccessEnabled(storage.isPathStyleAccess())
                .build());
        if (storage.getEndpoint() != null && !storage.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.getEndpoint().trim()));
        }
        return builder.build();
    }

    private static StaticCredentialsProvider credentials(ScraperProperties.Storage storage) {
        return StaticCredentialsProvider.create(
            AwsBasicCredentials.create(storage.getAccessKeyId().trim(), storage.getSecretAccessKey().trim())
        );
    }

    private static void closeQuietly(S3Client client) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (RuntimeException e) {
            log.debug("Ignoring error closing S3 client", e);
        }
    }
}
