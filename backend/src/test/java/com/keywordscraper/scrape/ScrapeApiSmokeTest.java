package com.keywordscraper.scrape;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.nio.charset.StandardCharsets;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class ScrapeApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void uploadEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/scraping/upload-csv"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void uploadRejectsMissingAndNonCsvFiles() throws Exception {
        mockMvc.perform(multipart("/api/scraping/upload-csv").param("scrapeImages", "true"))
            .andExpect(status().isBadRequest());

        MockMultipartFile notes = new MockMultipartFile(
            "files",
            "notes.txt",
            "text/plain",
            "pump\n".getBytes(StandardCharsets.UTF_8)
        );
        mockMvc.perform(multipart("/api/scraping/upload-csv").file(notes).param("scrapeImages", "true"))
            .andExpect(status().isBadRequest());

        MockMultipartFile empty = new MockMultipartFile(
            "files",
            "empty.csv",
            "text/csv",
            "\n , \n".getBytes(StandardCharsets.UTF_8)
        );
        mockMvc.perform(multipart("/api/scraping/upload-csv").file(empty))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownTaskIsReportedAsNotFound() throws Exception {
        mockMvc.perform(get("/api/scraping/progress/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("task_not_found"))
            .andExpect(jsonPath("$.message").value("Task not found: does-not-exist"));

        mockMvc.perform(post("/api/scraping/cancel/does-not-exist"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("task_not_found"));
    }

    @Test
    void itemsWithoutTaskOrAllItemsIsAnEmptyPage() throws Exception {
        mockMvc.perform(get("/api/scraping/items"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.items").isArray())
            .andExpect(jsonPath("$.items.length()").value(0))
            .andExpect(jsonPath("$.total").value(0))
            .andExpect(jsonPath("$.limit").value(50));
    }

    @Test
    void invalidContentTypeIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/scraping/download-bulk").param("taskId", "t").param("contentType", "audio"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/scraping/export-csv").param("taskId", "t").param("contentType", "audio"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/scraping/download-bulk").param("taskId", "t").param("contentType", "video"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void missingItemDownloadIsNotFound() throws Exception {
        mockMvc.perform(get("/api/scraping/download/{itemId}", -42))
            .andExpect(status().isNotFound());
    }

    @Test
    void statusReportsDatabaseAndStorage() throws Exception {
        mockMvc.perform(get("/api/scraping/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.storageAvailable").value(false))
            .andExpect(jsonPath("$.itemCounts.document").exists())
            .andExpect(jsonPath("$.tasksByStatus.processing").exists());
    }

    @Test
    void tasksEndpointReturnsArray() throws Exception {
        mockMvc.perform(get("/api/scraping/tasks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$").isArray());
    }
}
