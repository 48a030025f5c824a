package com.keywordscraper.scrape.api;

import com.keywordscraper.scrape.model.CancelTaskResponse;
import com.keywordscraper.scrape.model.ClearDatabaseResponse;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.DownloadPayload;
import com.keywordscraper.scrape.model.ItemPageResponse;
import com.keywordscraper.scrape.model.KeywordBatch;
import com.keywordscraper.scrape.model.ScrapeStatusResponse;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.ScrapeTaskView;
import com.keywordscraper.scrape.model.SourceFilesResponse;
import com.keywordscraper.scrape.model.SubmitRunResponse;
import com.keywordscraper.scrape.model.TaskSummaryView;
import com.keywordscraper.scrape.service.ItemExportService;
import com.keywordscraper.scrape.service.KeywordFileParser;
import com.keywordscraper.scrape.service.ScrapeOrchestratorService;
import com.keywordscraper.scrape.service.ScrapeStatusService;
import com.keywordscraper.scrape.service.TaskNotFoundException;
import com.keywordscraper.scrape.service.TaskRegistry;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/scraping")
public class ScrapeController {
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "on");

    private final ScrapeOrchestratorService orchestratorService;
    private final TaskRegistry taskRegistry;
    private final KeywordFileParser keywordFileParser;
    private final ItemExportService itemExportService;
    private final ScrapeStatusService statusService;

    public ScrapeController(
        ScrapeOrchestratorService orchestratorService,
        TaskRegistry taskRegistry,
        KeywordFileParser keywordFileParser,
        ItemExportService itemExportService,
        ScrapeStatusService statusService
    ) {
        this.orchestratorService = orchestratorService;
        this.taskRegistry = taskRegistry;
        this.keywordFileParser = keywordFileParser;
        this.itemExportService = itemExportService;
        this.statusService = statusService;
    }

    @PostMapping(value = "/upload-csv", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SubmitRunResponse uploadCsv(
        @RequestParam(name = "files", required = false) List<MultipartFile> files,
        @RequestParam(name = "scrapeDocuments", required = false, defaultValue = "false") String scrapeDocuments,
        @RequestParam(name = "scrapeImages", required = false, defaultValue = "false") String scrapeImages,
        @RequestParam(name = "scrapeVideos", required = false, defaultValue = "false") String scrapeVideos
    ) {
        if (files == null || files.isEmpty()) {
            throw new ResponseStatusException(BAD_REQUEST, "No files provided");
        }
        List<KeywordFileParser.Upload> uploads = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try {
                uploads.add(new KeywordFileParser.Upload(file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                throw new ResponseStatusException(BAD_REQUEST, "Unable to read " + file.getOriginalFilename(), e);
            }
        }

        KeywordBatch batch;
        try {
            batch = keywordFileParser.parse(uploads);
        } catch (IllegalArgumentException e) {
            throw new ResponseStatusException(BAD_REQUEST, e.getMessage(), e);
        }
        Set<ContentType> enabledTypes = ContentType.enabled(
            isTruthy(scrapeDocuments),
            isTruthy(scrapeImages),
            isTruthy(scrapeVideos)
        );
        return orchestratorService.submit(batch, enabledTypes);
    }

    @GetMapping("/progress/{taskId}")
    public ScrapeTaskView progress(@PathVariable("taskId") String taskId) {
        return ScrapeTaskView.from(taskRegistry.get(taskId));
    }

    @PostMapping("/cancel/{taskId}")
    public CancelTaskResponse cancel(@PathVariable("taskId") String taskId) {
        TaskRegistry.CancelOutcome outcome = orchestratorService.cancel(taskId);
        if (outcome == TaskRegistry.CancelOutcome.NOT_FOUND) {
            throw new TaskNotFoundException(taskId);
        }
        ScrapeTask task = taskRegistry.get(taskId);
        if (outcome == TaskRegistry.CancelOutcome.ALREADY_TERMINAL) {
            return new CancelTaskResponse(
                taskId,
                false,
                task.status(),
                "Task " + taskId + " is already " + task.status().name().toLowerCase(Locale.ROOT)
            );
        }
        return new CancelTaskResponse(taskId, true, task.status(), "Task " + taskId + " cancelled successfully");
    }

    @GetMapping("/tasks")
    public List<TaskSummaryView> tasks() {
        return taskRegistry.list().stream().map(TaskSummaryView::from).toList();
    }

    @PostMapping("/clear-database")
    public ClearDatabaseResponse clearDatabase() {
        return statusService.clearDatabase();
    }

    @GetMapping("/items")
    public ItemPageResponse items(
        @RequestParam(name = "taskId", required = false) String taskId,
        @RequestParam(name = "allItems", required = false, defaultValue = "false") boolean allItems,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Integer offset
    ) {
        return itemExportService.listItems(taskId, allItems, limit, offset);
    }

    @GetMapping("/download/{itemId}")
    public ResponseEntity<byte[]> download(@PathVariable("itemId") long itemId) {
        return attachment(itemExportService.download(itemId));
    }

    @GetMapping("/download-bulk")
    public ResponseEntity<byte[]> downloadBulk(
        @RequestParam(name = "taskId") String taskId,
        @RequestParam(name = "contentType") String contentType
    ) {
        return attachment(itemExportService.downloadBulk(taskId, contentType));
    }

    @GetMapping("/source-files")
    public SourceFilesResponse sourceFiles(@RequestParam(name = "taskId") String taskId) {
        return itemExportService.sourceFiles(taskId);
    }

    @GetMapping("/download-source-file-csv")
    public ResponseEntity<byte[]> downloadSourceFileCsv(
        @RequestParam(name = "sourceFile") String sourceFile,
        @RequestParam(name = "taskId", required = false) String taskId
    ) {
        return attachment(itemExportService.sourceFileCsv(sourceFile, taskId));
    }

    @GetMapping("/export-csv")
    public ResponseEntity<byte[]> exportCsv(
        @RequestParam(name = "taskId") String taskId,
        @RequestParam(name = "contentType") String contentType
    ) {
        return attachment(itemExportService.exportCsv(taskId, contentType));
    }

    @GetMapping("/status")
    public ScrapeStatusResponse status() {
        return statusService.getStatus();
    }

    private ResponseEntity<byte[]> attachment(DownloadPayload payload) {
        ContentDisposition disposition = ContentDisposition.attachment()
            .filename(payload.filename(), StandardCharsets.UTF_8)
            .build();
        return ResponseEntity.ok()
            .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
            .contentType(MediaType.parseMediaType(payload.mediaType()))
            .contentLength(payload.content().length)
            .body(payload.content());
    }

    private boolean isTruthy(String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }
}
