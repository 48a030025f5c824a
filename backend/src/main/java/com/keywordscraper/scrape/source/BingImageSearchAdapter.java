package com.keywordscraper.scrape.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.http.ScrapeHttpClient;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.HttpFetchResult;
import com.keywordscraper.scrape.model.SourceCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Image search over the Bing async image results page. Each result anchor carries
 * its metadata as JSON in the {@code m} attribute.
 */
@Component
public class BingImageSearchAdapter implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(BingImageSearchAdapter.class);

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp");
    private static final Set<String> ENTERTAINMENT_TERMS = Set.of(
        "game", "gaming", "gamer", "video game", "pc game", "console",
        "playstation", "xbox", "nintendo", "esports", "twitch",
        "stream", "livestream", "esport"
    );
    private static final List<String> BOILER_CONTEXT_TERMS = List.of(
        "boiler", "drum", "foster", "wheeler", "leak", "power", "plant", "turbine", "industrial"
    );
    private static final int LENIENT_MAX_RESULTS = 2;

    private final ScrapeHttpClient httpClient;
    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;

    public BingImageSearchAdapter(ScrapeHttpClient httpClient, ScraperProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ContentType contentType() {
        return ContentType.IMAGE;
    }

    @Override
    public List<SourceCandidate> search(String keyword, int maxResults) throws ContentSourceException {
        ScraperProperties.Image config = properties.getImage();
        int pageSize = config.getPageSize();
        int pages = pagesFor(maxResults, pageSize, config.getMaxPages());
        Map<String, SourceCandidate> found = new LinkedHashMap<>();
        int failedPages = 0;
        HttpFetchResult lastFailure = null;
        for (int page = 0; page < pages && found.size() < maxResults; page++) {
            String url = config.getBaseUrl()
                + "/images/async?q=" + URLEncoder.encode(keyword, StandardCharsets.UTF_8)
                + "&first=" + (page * pageSize)
                + "&count=" + pageSize
                + "&adlt=off";
            HttpFetchResult result = httpClient.get(url, "text/html,application/xhtml+xml");
            if (!result.isSuccessful()) {
                failedPages++;
                lastFailure = result;
                log.warn(
                    "Image page {} failed for '{}': status={} error={}",
                    page + 1,
                    keyword,
                    result.statusCode(),
                    result.errorCode()
                );
                continue;
            }
            parsePage(result.body(), keyword, maxResults, found);
        }
        if (found.isEmpty() && failedPages == pages && lastFailure != null) {
            String code = lastFailure.errorCode() != null ? lastFailure.errorCode() : "http_" + lastFailure.statusCode();
            throw new ContentSourceException(
                ScrapeHttpClient.ERROR_TIMEOUT.equals(code) ? ScrapeHttpClient.ERROR_TIMEOUT : ContentSourceRegistry.ERROR_SOURCE,
                "Image search failed for '" + keyword + "': " + code
            );
        }
        return new ArrayList<>(found.values());
    }

    static int pagesFor(int maxResults, int pageSize, int maxPages) {
        if (maxResults <= pageSize) {
            return 1;
        }
        return Math.min(maxPages, maxResults / pageSize + 1);
    }

    void parsePage(String html, String keyword, int maxResults, Map<String, SourceCandidate> found) {
        Document doc = Jsoup.parse(html == null ? "" : html);
        for (Element anchor : doc.select("a.iusc[m]")) {
            if (found.size() >= maxResults) {
                return;
            }
            JsonNode meta;
            try {
                meta = objectMapper.readTree(anchor.attr("m"));
            } catch (IOException e) {
                continue;
            }
            String imageUrl = meta.path("murl").asText("");
            if (imageUrl.isBlank() || found.containsKey(imageUrl) || !hasImageExtension(imageUrl)) {
                continue;
            }
            String pageTitle = meta.path("t").asText("");
            String pageDesc = meta.path("desc").asText("");
            String pageUrl = meta.path("purl").asText("");
            if (isExcludedDomain(imageUrl) || isExcludedDomain(pageUrl)) {
                continue;
            }
            if (containsEntertainmentTerms(pageTitle, pageDesc, pageUrl)) {
                continue;
            }
            if (maxResults > LENIENT_MAX_RESULTS && !isRelevant(keyword, pageTitle, pageDesc, pageUrl)) {
                continue;
            }
            found.put(imageUrl, SourceCandidate.of(
                imageUrl,
                pageTitle.isBlank() ? keyword : pageTitle,
                pageDesc.isBlank() ? "Image result for: " + keyword : pageDesc
            ));
        }
    }

    private boolean hasImageExtension(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        for (String extension : IMAGE_EXTENSIONS) {
            if (lower.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    boolean isExcludedDomain(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        String host;
        try {
            host = new URI(url.trim()).getHost();
        } catch (URISyntaxException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String domain = host.toLowerCase(Locale.ROOT);
        if (domain.startsWith("www.")) {
            domain = domain.substring(4);
        }
        for (String excluded : properties.getImage().getExcludedDomains()) {
            String candidate = excluded.toLowerCase(Locale.ROOT);
            if (domain.equals(candidate) || domain.endsWith("." + candidate)) {
                return true;
            }
        }
        return false;
    }

    private boolean containsEntertainmentTerms(String title, String desc, String pageUrl) {
        String text = String.join(" ", title, desc, pageUrl).toLowerCase(Locale.ROOT);
        for (String term : ENTERTAINMENT_TERMS) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }

    private boolean isRelevant(String keyword, String title, String desc, String pageUrl) {
        String keywordLower = keyword.toLowerCase(Locale.ROOT);
        String[] terms = keywordLower.trim().split("\\s+");
        String titleLower = title.toLowerCase(Locale.ROOT);
        String descLower = desc.toLowerCase(Locale.ROOT);
        String pageUrlLower = pageUrl.toLowerCase(Locale.ROOT);
        int matches = 0;
        for (String term : terms) {
            if (titleLower.contains(term) || descLower.contains(term) || pageUrlLower.contains(term)) {
                matches++;
            }
        }
        // "steam" alone is ambiguous; require boiler context
        if (keywordLower.contains("steam") && matches == 1 && titleLower.contains("steam")) {
            boolean boilerContext = false;
            for (String term : BOILER_CONTEXT_TERMS) {
                if (titleLower.contains(term) || descLower.contains(term)) {
                    boilerContext = true;
                    break;
                }
            }
            if (!boilerContext) {
                return false;
            }
        }
        int minMatches = terms.length > 2 ? 2 : 1;
        return matches >= minMatches || title.isBlank();
    }
}
