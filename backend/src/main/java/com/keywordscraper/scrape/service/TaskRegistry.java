package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * In-memory store of scrape tasks. Each entry is an immutable {@link ScrapeTask}
 * replaced through {@link ConcurrentHashMap#computeIfPresent}, so readers always see
 * a complete snapshot and a terminal status can never be overwritten.
 * Tasks are not persisted and are lost on restart.
 */
@Component
public class TaskRegistry {
    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    public enum CancelOutcome {
        CANCEL_REQUESTED,
        ALREADY_TERMINAL,
        NOT_FOUND
    }

    private final Map<String, ScrapeTask> tasks = new ConcurrentHashMap<>();
    private final Map<String, CancellationToken> tokens = new ConcurrentHashMap<>();
    private final Clock clock;

    public TaskRegistry() {
        this(Clock.systemUTC());
    }

    TaskRegistry(Clock clock) {
        this.clock = clock;
    }

    public String create(ScrapeTask task) {
        if (task == null || task.id() == null) {
            throw new IllegalArgumentException("task id is required");
        }
        tokens.put(task.id(), new CancellationToken());
        if (tasks.putIfAbsent(task.id(), task) != null) {
            throw new IllegalStateException("Task already registered: " + task.id());
        }
        return task.id();
    }

    public ScrapeTask get(String taskId) {
        ScrapeTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    public ScrapeTask find(String taskId) {
        return taskId == null ? null : tasks.get(taskId);
    }

    /**
     * Applies a state transition to a processing task. Updates to a task that is
     * already terminal are ignored and the stored snapshot is returned unchanged.
     */
    public ScrapeTask update(String taskId, UnaryOperator<ScrapeTask> mutator) {
        ScrapeTask updated = tasks.computeIfPresent(taskId, (id, current) -> {
            if (current.status().isTerminal()) {
                return current;
            }
            ScrapeTask next = mutator.apply(current);
            return next == null ? current : next;
        });
        if (updated == null) {
            throw new TaskNotFoundException(taskId);
        }
        return updated;
    }

    public ScrapeTask finish(String taskId, TaskStatus terminal, String message) {
        return update(taskId, task -> task.withTerminalStatus(terminal, message, Instant.now(clock)));
    }

    public CancelOutcome cancel(String taskId) {
        ScrapeTask task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            return CancelOutcome.NOT_FOUND;
        }
        if (task.status().isTerminal()) {
            return CancelOutcome.ALREADY_TERMINAL;
        }
        CancellationToken token = tokens.computeIfAbsent(taskId, ignored -> new CancellationToken());
        if (token.cancel()) {
            log.info("Cancellation requested for task {}", taskId);
        }
        return CancelOutcome.CANCEL_REQUESTED;
    }

    public CancellationToken token(String taskId) {
        return tokens.computeIfAbsent(taskId, ignored -> new CancellationToken());
    }

    public boolean isCancellationRequested(String taskId) {
        CancellationToken token = tokens.get(taskId);
        return token != null && token.isCancelled();
    }

    /**
     * Requests cancellation of every processing task other than {@code exceptTaskId}.
     *
     * @return ids of the tasks that were asked to stop
     */
    public List<String> cancelAllProcessing(String exceptTaskId) {
        List<String> cancelled = new ArrayList<>();
        for (ScrapeTask task : tasks.values()) {
            if (task.id().equals(exceptTaskId) || task.status().isTerminal()) {
                continue;
            }
            if (cancel(task.id()) == CancelOutcome.CANCEL_REQUESTED) {
                cancelled.add(task.id());
            }
        }
        return cancelled;
    }

    public List<ScrapeTask> list() {
        List<ScrapeTask> out = new ArrayList<>(tasks.values());
        out.sort(Comparator.comparing(ScrapeTask::createdAt).thenComparing(ScrapeTask::id));
        return out;
    }

    public Map<String, Long> countByStatus() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status.key(), 0L);
        }
        for (ScrapeTask task : tasks.values()) {
            counts.merge(task.status().key(), 1L, Long::sum);
        }
        return counts;
    }
}
