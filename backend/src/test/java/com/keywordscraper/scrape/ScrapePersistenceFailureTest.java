package com.keywordscraper.scrape;

import com.keywordscraper.scrape.model.ContentCounts;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.KeywordBatch;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.model.ScrapedItem;
import com.keywordscraper.scrape.model.SubmitRunResponse;
import com.keywordscraper.scrape.model.TaskStatus;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.service.ScrapeOrchestratorService;
import com.keywordscraper.scrape.service.TaskRegistry;
import com.keywordscraper.scrape.source.ContentSourceRegistry;
import com.keywordscraper.scrape.source.StubContentSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.doCallRealMethod;

/**
 * Runs a task against the real database while one insert fails, checking what
 * stays committed.
 */
@SpringBootTest
@ActiveProfiles("test")
class ScrapePersistenceFailureTest {
    private static final List<String> CALL_LOG = new CopyOnWriteArrayList<>();

    @TestConfiguration
    static class StubSources {
        @Bean
        @Primary
        ContentSourceRegistry stubContentSourceRegistry() {
            StubContentSource images = new StubContentSource(ContentType.IMAGE, CALL_LOG)
                .returning("pump", "https://img.example/pump-1.jpg", "https://img.example/pump-2.jpg")
                .returning("valve", "https://img.example/valve-1.jpg", "https://img.example/valve-2.jpg")
                .returning("boiler", "https://img.example/boiler-1.jpg");
            return new ContentSourceRegistry(List.of(images));
        }
    }

    @SpyBean
    private ScrapeItemJdbcRepository repository;

    @Autowired
    private ScrapeOrchestratorService orchestrator;

    @Autowired
    private TaskRegistry taskRegistry;

    @BeforeEach
    void setUp() {
        repository.deleteAllItems();
        CALL_LOG.clear();
    }

    @Test
    void failedInsertEndsTaskWithoutRemovingCommittedItems() throws InterruptedException {
        doCallRealMethod()
            .doThrow(new DataAccessResourceFailureException("connection lost"))
            .when(repository).insertItem(argThat(item -> item != null && "valve".equals(item.keyword())), any());
        Map<String, String> files = new LinkedHashMap<>();
        files.put("pump", "plant.csv");
        files.put("valve", "plant.csv");
        files.put("boiler", "plant.csv");

        SubmitRunResponse response = orchestrator.submit(
            new KeywordBatch(List.of("pump", "valve", "boiler"), files, List.of("plant.csv")),
            EnumSet.of(ContentType.IMAGE)
        );
        ScrapeTask task = awaitTerminal(response.taskId());

        assertThat(task.status()).isEqualTo(TaskStatus.ERROR);
        assertThat(task.errorMessage()).contains("connection lost");
        assertThat(task.counts()).isEqualTo(new ContentCounts(0, 2, 0));
        List<ScrapedItem> stored = repository.findItemsByTask(response.taskId(), 0, 50);
        assertThat(stored).extracting(ScrapedItem::url).containsExactlyInAnyOrder(
            "https://img.example/pump-1.jpg",
            "https://img.example/pump-2.jpg",
            "https://img.example/valve-1.jpg"
        );
        assertThat(CALL_LOG).containsExactly("image:pump", "image:valve");
    }

    private ScrapeTask awaitTerminal(String taskId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        ScrapeTask task = taskRegistry.get(taskId);
        while (!task.status().isTerminal() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            task = taskRegistry.get(taskId);
        }
        assertThat(task.status().isTerminal()).as("task %s finished", taskId).isTrue();
        return task;
    }
}
