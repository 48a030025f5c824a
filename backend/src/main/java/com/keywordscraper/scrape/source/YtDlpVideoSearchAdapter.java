package com.keywordscraper.scrape.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.SourceCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Video search through the yt-dlp command line tool ({@code ytsearchN:keyword}).
 */
@Component
public class YtDlpVideoSearchAdapter implements ContentSourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(YtDlpVideoSearchAdapter.class);
    private static final int MAX_DESCRIPTION_CHARS = 500;

    private final ScraperProperties properties;
    private final ObjectMapper objectMapper;

    public YtDlpVideoSearchAdapter(ScraperProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ContentType contentType() {
        return ContentType.VIDEO;
    }

    @Override
    public List<SourceCandidate> search(String keyword, int maxResults) throws ContentSourceException {
        ScraperProperties.Video config = properties.getVideo();
        List<String> command = List.of(
            config.getCommand(),
            "ytsearch" + maxResults + ":" + keyword,
            "--dump-json",
            "--no-playlist",
            "--default-search", "ytsearch",
            "--quiet",
            "--no-warnings"
        );
        ExternalCommand.Output output = ExternalCommand.run(command, config.getSearchTimeoutSeconds());
        if (output.exitCode() != 0 && (output.stdout() == null || output.stdout().isBlank())) {
            throw new ContentSourceException(
                ContentSourceRegistry.ERROR_SOURCE,
                "yt-dlp exited with code " + output.exitCode() + " for '" + keyword + "'"
            );
        }
        List<SourceCandidate> candidates = parseOutput(output.stdout());
        return candidates.size() > maxResults ? candidates.subList(0, maxResults) : candidates;
    }

    /**
     * Parses {@code --dump-json} output: one JSON object per line. Lines that are not
     * valid JSON or have no page URL are skipped.
     */
    List<SourceCandidate> parseOutput(String stdout) {
        List<SourceCandidate> out = new ArrayList<>();
        if (stdout == null || stdout.isBlank()) {
            return out;
        }
        for (String line : stdout.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode video;
            try {
                video = objectMapper.readTree(line);
            } catch (IOException e) {
                log.debug("Skipping non-JSON yt-dlp line");
                continue;
            }
            String url = video.path("webpage_url").asText("");
            if (url.isBlank()) {
                continue;
            }
            String description = video.path("description").asText("");
            if (description.length() > MAX_DESCRIPTION_CHARS) {
                description = description.substring(0, MAX_DESCRIPTION_CHARS);
            }
            JsonNode duration = video.path("duration");
            String thumbnail = video.path("thumbnail").asText("");
            out.add(new SourceCandidate(
                url,
                video.path("title").asText(""),
                description,
                thumbnail.isBlank() ? null : thumbnail,
                duration.isNumber() ? duration.asInt() : null,
                null
            ));
        }
        return out;
    }
}
