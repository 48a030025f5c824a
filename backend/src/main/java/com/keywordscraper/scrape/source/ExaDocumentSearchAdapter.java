package com.keywordscraper.scrape.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.http.ScrapeHttpClient;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.HttpFetchResult;
import com.keywordscraper.scrape.model.SourceCandidate;
import com.keywordscraper.scrape.util.MediaFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * PDF search through the Exa search API. Runs the configured query templates in
 * order until enough direct PDF links have been collected.
 */
@Component
public class ExaDocumentSearchAdapter implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ExaDocumentSearchAdapter.class);
    private static final int MAX_TITLE_CHARS = 200;
    private static final int MAX_DESCRIPTION_CHARS = 500;
    private static final int RESULTS_PER_QUERY_FACTOR = 3;

    private final ScrapeHttpClient httpClient;
    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;

    public ExaDocumentSearchAdapter(ScrapeHttpClient httpClient, ScraperProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ContentType contentType() {
        return ContentType.DOCUMENT;
    }

    @Override
    public List<SourceCandidate> search(String keyword, int maxResults) throws ContentSourceException {
        ScraperProperties.Document config = properties.getDocument();
        String apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Document search skipped for '{}': no Exa API key configured", keyword);
            return List.of();
        }
        List<SourceCandidate> out = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int failedQueries = 0;
        String lastErrorCode = null;
        String lastErrorMessage = null;
        List<String> templates = config.getQueryTemplates();
        for (String template : templates) {
            if (out.size() >= maxResults) {
                break;
            }
            String query = String.format(Locale.ROOT, template, keyword);
            HttpFetchResult result = httpClient.postJson(
                trimTrailingSlash(config.getBaseUrl()) + "/search",
                requestBody(query, maxResults * RESULTS_PER_QUERY_FACTOR),
                Map.of("x-api-key", apiKey)
            );
            if (!result.isSuccessful()) {
                failedQueries++;
                lastErrorCode = result.errorCode() != null ? result.errorCode() : "http_" + result.statusCode();
                lastErrorMessage = result.errorMessage();
                log.warn("Exa query '{}' failed: {} {}", query, lastErrorCode, lastErrorMessage);
                continue;
            }
            int found = collectPdfResults(result.body(), keyword, maxResults, seen, out);
            log.debug("Exa query '{}' yielded {} PDFs", query, found);
        }
        if (out.isEmpty() && !templates.isEmpty() && failedQueries == templates.size()) {
            throw new ContentSourceException(
                ScrapeHttpClient.ERROR_TIMEOUT.equals(lastErrorCode) ? ScrapeHttpClient.ERROR_TIMEOUT : ContentSourceRegistry.ERROR_SOURCE,
                "Exa search failed: " + lastErrorCode + (lastErrorMessage == null ? "" : " " + lastErrorMessage)
            );
        }
        return out;
    }

    int collectPdfResults(String body, String keyword, int maxResults, Set<String> seen, List<SourceCandidate> out) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (IOException e) {
            log.warn("Unparseable Exa response for '{}': {}", keyword, e.getMessage());
            return 0;
        }
        JsonNode results = root == null ? null : root.path("results");
        if (results == null || !results.isArray()) {
            return 0;
        }
        int found = 0;
        for (JsonNode node : results) {
            if (out.size() >= maxResults) {
                break;
            }
            String url = node.path("url").asText("");
            String clean = MediaFiles.stripQuery(url);
            if (!isDirectPdf(clean) || !seen.add(clean)) {
                continue;
            }
            String title = node.path("title").asText("");
            String text = node.path("text").asText("");
            out.add(SourceCandidate.of(
                clean,
                title.isBlank() ? keyword : truncate(title, MAX_TITLE_CHARS),
                text.isBlank() ? "PDF document for: " + keyword : truncate(text, MAX_DESCRIPTION_CHARS)
            ));
            found++;
        }
        return found;
    }

    static boolean isDirectPdf(String cleanUrl) {
        return cleanUrl != null
            && cleanUrl.startsWith("http")
            && cleanUrl.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private String requestBody(String query, int numResults) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("query", query);
        body.put("numResults", numResults);
        body.putObject("contents").putObject("text").put("maxCharacters", MAX_DESCRIPTION_CHARS);
        return body.toString();
    }

    private String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        return value.endsWith("/") ? value.substring(0, value.length() - 1) : value;
    }

    private String truncate(String value, int maxChars) {
        return value.length() <= maxChars ? value : value.substring(0, maxChars);
    }
}
