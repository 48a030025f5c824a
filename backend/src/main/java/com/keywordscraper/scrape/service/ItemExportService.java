package com.keywordscraper.scrape.service;

import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.http.ScrapeHttpClient;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.DownloadPayload;
import com.keywordscraper.scrape.model.HttpFetchResult;
import com.keywordscraper.scrape.model.ItemPageResponse;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.ScrapedItem;
import com.keywordscraper.scrape.model.SourceFilesResponse;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.storage.ObjectStorageService;
import com.keywordscraper.scrape.util.MediaFiles;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.springframework.http.HttpStatus.BAD_GATEWAY;
import static org.springframework.http.HttpStatus.BAD_REQUEST;
import static org.springframework.http.HttpStatus.GATEWAY_TIMEOUT;
import static org.springframework.http.HttpStatus.NOT_FOUND;
import static org.springframework.http.HttpStatus.PAYLOAD_TOO_LARGE;

/**
 * Read side of the item store: paging, single and bulk downloads, and CSV exports.
 */
@Service
public class ItemExportService {
    private static final Logger log = LoggerFactory.getLogger(ItemExportService.class);

    private static final String CSV_MEDIA_TYPE = "text/csv";
    private static final String ZIP_MEDIA_TYPE = "application/zip";
    private static final String[] SOURCE_FILE_COLUMNS = {
        "id", "keyword", "scraped_url", "content_type", "title", "task_id", "source_file",
        "created_at", "storage_download_url", "storage_key"
    };
    private static final String[] EXPORT_COLUMNS = {"id", "keyword", "url", "title"};

    private final ScrapeItemJdbcRepository repository;
    private final ObjectStorageService storage;
    private final ScrapeHttpClient httpClient;
    private final TaskRegistry registry;
    private final ScraperProperties properties;

    public ItemExportService(
        ScrapeItemJdbcRepository repository,
        ObjectStorageService storage,
        ScrapeHttpClient httpClient,
        TaskRegistry registry,
        ScraperProperties properties
    ) {
        this.repository = repository;
        this.storage = storage;
        this.httpClient = httpClient;
        this.registry = registry;
        this.properties = properties;
    }

    /**
     * {@code allItems} pages the whole store, a task id pages that task, and
     * neither yields an empty page. A non-positive limit disables paging.
     */
    public ItemPageResponse listItems(String taskId, boolean allItems, Integer limit, Integer offset) {
        int safeOffset = offset == null ? 0 : Math.max(0, offset);
        int safeLimit = limit == null ? properties.getApi().getDefaultItemLimit() : limit;
        if (safeLimit > 0) {
            safeLimit = Math.min(safeLimit, properties.getApi().getMaxItemLimit());
        }

        List<ScrapedItem> rows;
        long total;
        if (allItems) {
            rows = repository.findAllItems(safeOffset, safeLimit);
            total = repository.countItems();
        } else if (taskId != null && !taskId.isBlank()) {
            rows = repository.findItemsByTask(taskId.trim(), safeOffset, safeLimit);
            total = repository.countItemsByTask(taskId.trim());
        } else {
            return new ItemPageResponse(List.of(), 0, safeLimit, safeOffset);
        }
        return new ItemPageResponse(withFreshLinks(rows), total, safeLimit, safeOffset);
    }

    public DownloadPayload download(long itemId) {
        ScrapedItem item = repository.findItemById(itemId);
        if (item == null) {
            throw new ResponseStatusException(NOT_FOUND, "Item not found: " + itemId);
        }
        if (item.contentType() == ContentType.VIDEO) {
            throw new ResponseStatusException(BAD_REQUEST, "Videos cannot be downloaded directly; use the video URL");
        }
        if (item.contentType() == null) {
            throw new ResponseStatusException(BAD_REQUEST, "Item " + itemId + " has an unknown content type");
        }

        HttpFetchResult fetched = httpClient.get(fetchUrl(item), "*/*", properties.getStorage().maxDownloadBytes());
        if (ScrapeHttpClient.ERROR_BODY_TOO_LARGE.equals(fetched.errorCode())) {
            throw new ResponseStatusException(
                PAYLOAD_TOO_LARGE,
                "File exceeds the " + properties.getStorage().getMaxDownloadSizeMb() + " MB download limit"
            );
        }
        if (ScrapeHttpClient.ERROR_TIMEOUT.equals(fetched.errorCode())) {
            throw new ResponseStatusException(GATEWAY_TIMEOUT, "Timed out fetching item " + itemId);
        }
        if (!fetched.isSuccessful() || fetched.bodyBytes() == null) {
            String reason = fetched.errorCode() != null ? fetched.errorCode() : "HTTP " + fetched.statusCode();
            throw new ResponseStatusException(BAD_GATEWAY, "Failed to fetch item " + itemId + ": " + reason);
        }

        String extension = fileExtension(item, fetched.contentType());
        String mediaType = item.contentType() == ContentType.DOCUMENT
            ? "application/pdf"
            : MediaFiles.imageMediaType(extension);
        return new DownloadPayload(
            MediaFiles.downloadFilename(item.id(), item.keyword(), extension),
            mediaType,
            fetched.bodyBytes()
        );
    }

    /**
     * Zips every item of one content type for a task. Items that cannot be fetched
     * or exceed the size limit are left out.
     */
    public DownloadPayload downloadBulk(String taskId, String contentType) {
        ContentType type = parseType(contentType);
        if (type == ContentType.VIDEO) {
            throw new ResponseStatusException(BAD_REQUEST, "Videos cannot be downloaded as ZIP files");
        }
        List<ScrapedItem> items = repository.findItemsByTaskAndType(taskId, type);
        if (items.isEmpty()) {
            throw new ResponseStatusException(NOT_FOUND, "No " + type.key() + " items found for task " + taskId);
        }

        long maxBytes = properties.getStorage().maxDownloadBytes();
        int downloaded = 0;
        int skipped = 0;
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
            for (ScrapedItem item : items) {
                HttpFetchResult fetched = httpClient.get(fetchUrl(item), "*/*", maxBytes);
                if (!fetched.isSuccessful() || fetched.bodyBytes() == null) {
                    skipped++;
                    log.debug("Bulk download skipped item {}: {}", item.id(), fetched.errorCode() != null
                        ? fetched.errorCode()
                        : "HTTP " + fetched.statusCode());
                    continue;
                }
                String extension = fileExtension(item, fetched.contentType());
                zip.putNextEntry(new ZipEntry(MediaFiles.downloadFilename(item.id(), item.keyword(), extension)));
                zip.write(fetched.bodyBytes());
                zip.closeEntry();
                downloaded++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build ZIP for task " + taskId, e);
        }

        if (downloaded == 0) {
            throw new ResponseStatusException(BAD_GATEWAY, "Failed to download any " + type.key() + " files");
        }
        if (skipped > 0) {
            log.info("Bulk download for task {} ({}): {} files, {} skipped", taskId, type.key(), downloaded, skipped);
        }
        return new DownloadPayload(
            type.key() + "_" + taskId + "_" + downloaded + "files.zip",
            ZIP_MEDIA_TYPE,
            buffer.toByteArray()
        );
    }

    public SourceFilesResponse sourceFiles(String taskId) {
        ScrapeTask task = registry.find(taskId);
        if (task != null && !task.files().isEmpty()) {
            return new SourceFilesResponse(taskId, task.files());
        }
        return new SourceFilesResponse(taskId, repository.findSourceFilesForTask(taskId));
    }

    /**
     * CSV of every item from {@code sourceFile}, restricted to the keywords that the
     * given task (or the most recent task touching that file) scraped for it.
     */
    public DownloadPayload sourceFileCsv(String sourceFile, String taskId) {
        if (sourceFile == null || sourceFile.isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "sourceFile is required");
        }
        String targetTask = taskId == null || taskId.isBlank()
            ? repository.findMostRecentTaskForSourceFile(sourceFile)
            : taskId.trim();
        Set<String> keywords = targetTask == null
            ? Set.of()
            : repository.findKeywordsForSourceFileAndTask(sourceFile, targetTask);
        List<ScrapedItem> items = repository.findItemsForSourceFile(sourceFile, keywords);
        if (items.isEmpty()) {
            throw new ResponseStatusException(NOT_FOUND, "No items found for source file: " + sourceFile);
        }

        Duration expiry = Duration.ofSeconds(properties.getStorage().getPresignExpirySeconds());
        List<List<Object>> rows = new ArrayList<>(items.size());
        for (ScrapedItem item : items) {
            String link = item.hasStorageKey() ? storage.downloadUrl(item.storageKey(), expiry) : null;
            rows.add(List.of(
                item.id(),
                nullToEmpty(item.keyword()),
                nullToEmpty(item.url()),
                item.contentType() == null ? "" : item.contentType().key(),
                nullToEmpty(item.title()),
                nullToEmpty(item.taskId()),
                nullToEmpty(item.sourceFile()),
                item.createdAt() == null ? "" : item.createdAt().toString(),
                nullToEmpty(link),
                nullToEmpty(item.storageKey())
            ));
        }
        String baseName = sourceFile.endsWith(".csv")
            ? sourceFile.substring(0, sourceFile.length() - ".csv".length())
            : sourceFile;
        return new DownloadPayload(baseName + "_scraped_data.csv", CSV_MEDIA_TYPE, toCsv(SOURCE_FILE_COLUMNS, rows));
    }

    public DownloadPayload exportCsv(String taskId, String contentType) {
        ContentType type = parseType(contentType);
        List<ScrapedItem> items = repository.findItemsByTaskAndType(taskId, type);
        if (items.isEmpty()) {
            throw new ResponseStatusException(NOT_FOUND, "No " + type.key() + " items found for task " + taskId);
        }
        List<List<Object>> rows = new ArrayList<>(items.size());
        for (ScrapedItem item : items) {
            rows.add(List.of(item.id(), nullToEmpty(item.keyword()), nullToEmpty(item.url()), nullToEmpty(item.title())));
        }
        return new DownloadPayload(
            type.key() + "_" + taskId + "_" + items.size() + "items.csv",
            CSV_MEDIA_TYPE,
            toCsv(EXPORT_COLUMNS, rows)
        );
    }

    private List<ScrapedItem> withFreshLinks(List<ScrapedItem> rows) {
        Duration expiry = Duration.ofSeconds(properties.getStorage().getPresignExpirySeconds());
        List<ScrapedItem> out = new ArrayList<>(rows.size());
        for (ScrapedItem item : rows) {
            String link = item.hasStorageKey() ? storage.downloadUrl(item.storageKey(), expiry) : null;
            out.add(link == null ? item : item.withStorageUrl(link));
        }
        return out;
    }

    private String fetchUrl(ScrapedItem item) {
        if (item.hasStorageKey()) {
            String link = storage.downloadUrl(
                item.storageKey(),
                Duration.ofSeconds(properties.getStorage().getDownloadExpirySeconds())
            );
            if (link != null) {
                return link;
            }
        }
        if (item.storageUrl() != null && !item.storageUrl().isBlank()) {
            return item.storageUrl();
        }
        return item.url();
    }

    private String fileExtension(ScrapedItem item, String responseContentType) {
        if (item.contentType() == ContentType.DOCUMENT) {
            return ".pdf";
        }
        return MediaFiles.imageExtension(item.url(), responseContentType);
    }

    private ContentType parseType(String contentType) {
        try {
            return ContentType.parse(contentType);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(
                BAD_REQUEST,
                "Invalid content type: " + contentType + ". Must be document, image or video"
            );
        }
    }

    private byte[] toCsv(String[] header, List<List<Object>> rows) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(header).build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (List<Object> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
