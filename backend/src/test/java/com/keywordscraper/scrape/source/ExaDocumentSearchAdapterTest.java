package com.keywordscraper.scrape.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.http.ScrapeHttpClient;
import com.keywordscraper.scrape.model.SourceCandidate;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExaDocumentSearchAdapterTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void returnsNothingWithoutApiKey() throws Exception {
        ScraperProperties properties = testProperties();
        properties.getDocument().setApiKey(" ");

        assertThat(adapter(properties).search("heat exchanger", 2)).isEmpty();
    }

    @Test
    void collectsDirectPdfLinksAcrossQueryTemplates() throws Exception {
        server = new MockWebServer();
        server.enqueue(json("""
            {"results": [
              {"url": "https://plant.example.com/manual.pdf?download=1", "title": "Heat exchanger manual", "text": "Chapter 1"},
              {"url": "https://plant.example.com/overview.html", "title": "Overview", "text": "HTML page"}
            ]}
            """));
        server.enqueue(json("""
            {"results": [
              {"url": "https://plant.example.com/manual.pdf", "title": "Same manual again", "text": ""},
              {"url": "https://docs.example.org/datasheet.PDF", "title": "", "text": ""}
            ]}
            """));
        server.start();

        ScraperProperties properties = testProperties();
        properties.getDocument().setApiKey("exa-test-key");
        properties.getDocument().setBaseUrl(server.url("/").toString());

        List<SourceCandidate> results = adapter(properties).search("heat exchanger", 2);

        assertThat(results).extracting(SourceCandidate::url).containsExactly(
            "https://plant.example.com/manual.pdf",
            "https://docs.example.org/datasheet.PDF"
        );
        assertThat(results.get(0).title()).isEqualTo("Heat exchanger manual");
        assertThat(results.get(1).title()).isEqualTo("heat exchanger");
        assertThat(results.get(1).description()).isEqualTo("PDF document for: heat exchanger");
        assertThat(server.getRequestCount()).isEqualTo(2);

        RecordedRequest first = server.takeRequest();
        assertThat(first.getPath()).isEqualTo("/search");
        assertThat(first.getHeader("x-api-key")).isEqualTo("exa-test-key");
        JsonNode body = objectMapper.readTree(first.getBody().readUtf8());
        assertThat(body.path("query").asText()).isEqualTo("heat exchanger filetype:pdf");
        assertThat(body.path("numResults").asInt()).isEqualTo(6);
        assertThat(body.path("contents").path("text").path("maxCharacters").asInt()).isEqualTo(500);
    }

    @Test
    void truncatesLongTitlesAndText() {
        ScraperProperties properties = testProperties();
        ExaDocumentSearchAdapter adapter = adapter(properties);
        String body = "{\"results\":[{\"url\":\"https://x.example/a.pdf\",\"title\":\"" + "t".repeat(300)
            + "\",\"text\":\"" + "x".repeat(900) + "\"}]}";
        List<SourceCandidate> out = new ArrayList<>();

        int found = adapter.collectPdfResults(body, "kw", 2, new HashSet<>(), out);

        assertThat(found).isEqualTo(1);
        assertThat(out.get(0).title()).hasSize(200);
        assertThat(out.get(0).description()).hasSize(500);
    }

    @Test
    void directPdfRequiresHttpAndPdfSuffix() {
        assertThat(ExaDocumentSearchAdapter.isDirectPdf("https://a.example/report.pdf")).isTrue();
        assertThat(ExaDocumentSearchAdapter.isDirectPdf("ftp://a.example/report.pdf")).isFalse();
        assertThat(ExaDocumentSearchAdapter.isDirectPdf("https://a.example/report.pdf.html")).isFalse();
        assertThat(ExaDocumentSearchAdapter.isDirectPdf(null)).isFalse();
    }

    @Test
    void failsOnlyWhenEveryQueryFails() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\":\"bad key\"}"));
        server.start();

        ScraperProperties properties = testProperties();
        properties.getDocument().setApiKey("wrong");
        properties.getDocument().setBaseUrl(server.url("/").toString());
        ExaDocumentSearchAdapter adapter = adapter(properties);

        assertThatThrownBy(() -> adapter.search("heat exchanger", 2))
            .isInstanceOf(ContentSourceException.class)
            .hasMessageContaining("http_401");
    }

    private ExaDocumentSearchAdapter adapter(ScraperProperties properties) {
        executor = executor == null ? Executors.newFixedThreadPool(1) : executor;
        return new ExaDocumentSearchAdapter(new ScrapeHttpClient(properties, executor), properties, objectMapper);
    }

    private ScraperProperties testProperties() {
        ScraperProperties properties = new ScraperProperties();
        properties.setPerHostDelayMs(0);
        properties.setRequestMaxRetries(0);
        properties.setRequestTimeoutSeconds(5);
        return properties;
    }

    private static MockResponse json(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "application/json")
            .setBody(body);
    }
}
