package com.keywordscraper.scrape;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.ScrapeTask;
import com.keywordscraper.scrape.persistence.ScrapeItemJdbcRepository;
import com.keywordscraper.scrape.service.TaskRegistry;
import com.keywordscraper.scrape.source.ContentSourceRegistry;
import com.keywordscraper.scrape.source.StubContentSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeEndToEndTest {

    @TestConfiguration
    static class StubSources {
        @Bean
        @Primary
        ContentSourceRegistry stubContentSourceRegistry() {
            StubContentSource images = new StubContentSource(ContentType.IMAGE)
                .returning("pump", "https://img.example/pump-1.jpg", "https://img.example/pump-2.png", "https://img.example/pump-3.jpg")
                .returning("valve", "https://img.example/valve-1.jpg");
            StubContentSource documents = new StubContentSource(ContentType.DOCUMENT)
                .returning("pump", "https://doc.example/pump-manual.pdf")
                .failing("valve", "timeout");
            return new ContentSourceRegistry(List.of(images, documents));
        }
    }

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ScrapeItemJdbcRepository repository;

    @Autowired
    private TaskRegistry taskRegistry;

    @Autowired
    private ObjectMapper objectMapper;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
        repository.deleteAllItems();
    }

    @Test
    void uploadRunsToCompletionAndResumesOnReupload() throws Exception {
        String taskId = upload("pump\nvalve\n");
        awaitTerminal(taskId);

        mockMvc.perform(get("/api/scraping/progress/{taskId}", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.imageCount").value(3))
            .andExpect(jsonPath("$.documentCount").value(1))
            .andExpect(jsonPath("$.videoCount").value(0))
            .andExpect(jsonPath("$.currentKeywordIndex").value(2))
            .andExpect(jsonPath("$.errorMessage").doesNotExist());

        mockMvc.perform(get("/api/scraping/items").param("taskId", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(4))
            .andExpect(jsonPath("$.items.length()").value(4))
            .andExpect(jsonPath("$.items[0].sourceFile").value("plant.csv"));

        mockMvc.perform(get("/api/scraping/export-csv").param("taskId", taskId).param("contentType", "image"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", containsString("image_" + taskId + "_3items.csv")))
            .andExpect(content().string(containsString("id,keyword,url,title")))
            .andExpect(content().string(containsString("https://img.example/valve-1.jpg")));

        mockMvc.perform(get("/api/scraping/source-files").param("taskId", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sourceFiles[0]").value("plant.csv"));

        mockMvc.perform(get("/api/scraping/download-source-file-csv").param("sourceFile", "plant.csv"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", containsString("plant_scraped_data.csv")))
            .andExpect(content().string(containsString("https://doc.example/pump-manual.pdf")));

        mockMvc.perform(post("/api/scraping/cancel/{taskId}", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cancelRequested").value(false))
            .andExpect(jsonPath("$.message").value("Task " + taskId + " is already completed"));

        JsonNode again = submit("pump\nvalve\n");
        assertThat(again.get("resumableMode").asBoolean()).isTrue();
        assertThat(again.get("allKeywordsScraped").asBoolean()).isTrue();
        assertThat(again.get("totalKeywords").asInt()).isZero();
        assertThat(taskRegistry.get(again.get("taskId").asText()).status().isTerminal()).isTrue();

        JsonNode extended = submit("pump\nvalve\nboiler\n");
        assertThat(extended.get("resumableMode").asBoolean()).isTrue();
        assertThat(extended.get("newKeywordCount").asInt()).isEqualTo(1);
        assertThat(extended.get("skippedKeywordCount").asInt()).isEqualTo(2);
        String extendedId = extended.get("taskId").asText();
        ScrapeTask finished = awaitTerminal(extendedId);
        assertThat(finished.keywordsToProcess()).containsExactly("boiler");
        assertThat(finished.counts().total()).isZero();
        assertThat(repository.countItems()).isEqualTo(4);
    }

    @Test
    void storedUrlsAreNotScrapedTwiceAcrossFiles() throws Exception {
        String first = upload("pump\n");
        awaitTerminal(first);

        JsonNode other = submitFile("other.csv", "pump\n");
        assertThat(other.get("resumableMode").asBoolean()).isFalse();
        ScrapeTask second = awaitTerminal(other.get("taskId").asText());

        assertThat(second.counts().total()).isZero();
        assertThat(repository.countItems()).isEqualTo(3);
    }

    @Test
    void clearDatabaseRemovesEveryItem() throws Exception {
        awaitTerminal(upload("valve\n"));

        mockMvc.perform(post("/api/scraping/clear-database"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deletedCount").value(1))
            .andExpect(jsonPath("$.message").value("Successfully deleted 1 items from database"));

        assertThat(repository.countItems()).isZero();
    }

    private String upload(String csv) throws Exception {
        return submit(csv).get("taskId").asText();
    }

    private JsonNode submit(String csv) throws Exception {
        return submitFile("plant.csv", csv);
    }

    private JsonNode submitFile(String filename, String csv) throws Exception {
        MockMultipartFile file = new MockMultipartFile(
            "files",
            filename,
            "text/csv",
            csv.getBytes(StandardCharsets.UTF_8)
        );
        String body = mockMvc.perform(multipart("/api/scraping/upload-csv")
                .file(file)
                .param("scrapeImages", "true")
                .param("scrapeDocuments", "yes"))
            .andExpect(status().isOk())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(body);
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
