package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.KeywordBatch;
import com.keywordscraper.scrape.model.KeywordScrapeResult;
import com.keywordscraper.scrape.model.ResumePlan;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.SubmitRunResponse;
import com.keywordscraper.scrape.model.TaskStatus;
import com.keywordscraper.scrape.source.ContentSourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the lifecycle of scrape tasks: plans and registers a submission, then walks
 * its keywords in order on the single run executor until the task completes, is
 * cancelled or fails.
 */
@Service
public class ScrapeOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestratorService.class);

    private final TaskRegistry registry;
    private final ResumePlanner resumePlanner;
    private final KeywordScrapeService keywordScrapeService;
    private final ContentSourceRegistry sourceRegistry;
    private final ExecutorService scrapeRunExecutor;

    public ScrapeOrchestratorService(
        TaskRegistry registry,
        ResumePlanner resumePlanner,
        KeywordScrapeService keywordScrapeService,
        ContentSourceRegistry sourceRegistry,
        @Qualifier("scrapeRunExecutor") ExecutorService scrapeRunExecutor
    ) {
        this.registry = registry;
        this.resumePlanner = resumePlanner;
        this.keywordScrapeService = keywordScrapeService;
        this.sourceRegistry = sourceRegistry;
        this.scrapeRunExecutor = scrapeRunExecutor;
    }

    /**
     * Registers a new task for {@code batch} and schedules it. Any task still
     * processing is asked to stop first; stored items are never touched.
     */
    public SubmitRunResponse submit(KeywordBatch batch, Set<ContentType> enabledTypes) {
        ResumePlan plan = resumePlanner.plan(batch);
        String taskId = UUID.randomUUID().toString();
        ScrapeTask task = ScrapeTask.create(
            taskId,
            plan,
            batch.keywordToSourceFile(),
            batch.files(),
            enabledTypes,
            Instant.now()
        );

        List<String> superseded = registry.cancelAllProcessing(taskId);
        if (!superseded.isEmpty()) {
            log.info("New submission {} supersedes running tasks {}", taskId, superseded);
        }
        registry.create(task);
        log.info(
            "Task {} submitted: {} keywords to process from {} file(s), types={}, resumable={}",
            taskId,
            plan.keywordsToProcess().size(),
            batch.files().size(),
            enabledTypes,
            plan.resumableMode()
        );

        if (plan.keywordsToProcess().isEmpty()) {
            registry.finish(taskId, TaskStatus.COMPLETED, null);
            log.info("Task {} completed immediately: every keyword already scraped", taskId);
        } else {
            try {
                scrapeRunExecutor.submit(() -> runTask(taskId));
            } catch (RejectedExecutionException e) {
                log.warn("Task {} could not be scheduled", taskId, e);
                registry.finish(taskId, TaskStatus.ERROR, "Scrape executor unavailable");
            }
        }

        return new SubmitRunResponse(
            taskId,
            plan.keywordsToProcess().size(),
            batch.files().size(),
            plan.resumableMode(),
            plan.newKeywordCount(),
            plan.skippedKeywordCount(),
            plan.allKeywordsScraped()
        );
    }

    public TaskRegistry.CancelOutcome cancel(String taskId) {
        return registry.cancel(taskId);
    }

    void runTask(String taskId) {
        ScrapeTask task = registry.get(taskId);
        CancellationToken token = registry.token(taskId);
        List<String> keywords = task.keywordsToProcess();
        log.info("Task {} started: {} keywords", taskId, keywords.size());

        try (ContentSourceRegistry.SourceRun sources = sourceRegistry.openRun(task.enabledTypes())) {
            for (int index = 0; index < keywords.size(); index++) {
                if (token.isCancelled()) {
                    finishCancelled(taskId, index);
                    return;
                }
                String raw = keywords.get(index);
                String keyword = raw == null ? "" : raw.trim();
                if (keyword.isEmpty()) {
                    log.warn("Task {} skipped blank keyword at position {}", taskId, index + 1);
                    continue;
                }
                if (!task.isKeywordAllowed(keyword)) {
                    log.warn("Task {} skipped keyword '{}': not in the allowed keyword list", taskId, keyword);
                    continue;
                }

                int position = index + 1;
                registry.update(taskId, current -> current.withProgress(keyword, position, Instant.now()));
                KeywordScrapeResult result = keywordScrapeService.scrapeKeyword(task, keyword, sources);
                registry.update(taskId, current -> current.withAddedCounts(result.added(), Instant.now()));
                log.info(
                    "Task {} keyword {}/{} '{}': documents={} images={} videos={}{}",
                    taskId,
                    position,
                    keywords.size(),
                    keyword,
                    result.added().document(),
                    result.added().image(),
                    result.added().video(),
                    result.sourceErrors().isEmpty() ? "" : " sourceErrors=" + result.sourceErrors()
                );
            }
            if (token.isCancelled()) {
                finishCancelled(taskId, keywords.size());
                return;
            }
            ScrapeTask finished = registry.finish(taskId, TaskStatus.COMPLETED, null);
            log.info(
                "Task {} completed: documents={} images={} videos={}",
                taskId,
                finished.counts().document(),
                finished.counts().image(),
                finished.counts().video()
            );
        } catch (RuntimeException e) {
            log.warn("Task {} failed", taskId, e);
            registry.finish(taskId, TaskStatus.ERROR, errorMessage(e));
        } catch (Error e) {
            log.error("Task {} aborted", taskId, e);
            registry.finish(taskId, TaskStatus.ERROR, errorMessage(e));
            throw e;
        }
    }

    private void finishCancelled(String taskId, int keywordsStarted) {
        registry.finish(taskId, TaskStatus.CANCELLED, null);
        log.info("Task {} cancelled after {} keyword(s)", taskId, keywordsStarted);
    }

    private String errorMessage(Throwable e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
