package com.keywordscraper.scrape.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.model.SourceCandidate;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YtDlpVideoSearchAdapterTest {

    @Test
    void parsesOneVideoPerJsonLine() {
        YtDlpVideoSearchAdapter adapter = new YtDlpVideoSearchAdapter(new ScraperProperties(), new ObjectMapper());
        String longDescription = "d".repeat(800);
        String stdout = String.join("\n",
            "{\"webpage_url\":\"https://www.youtube.com/watch?v=abc\",\"title\":\"Boiler tour\","
                + "\"description\":\"" + longDescription + "\",\"thumbnail\":\"https://i.ytimg.com/abc.jpg\",\"duration\":245}",
            "WARNING: not json",
            "",
            "{\"title\":\"no url\"}",
            "{\"webpage_url\":\"https://www.youtube.com/watch?v=def\",\"title\":\"Drum level\",\"duration\":\"n/a\"}"
        );

        List<SourceCandidate> videos = adapter.parseOutput(stdout);

        assertThat(videos).hasSize(2);
        SourceCandidate first = videos.get(0);
        assertThat(first.url()).isEqualTo("https://www.youtube.com/watch?v=abc");
        assertThat(first.title()).isEqualTo("Boiler tour");
        assertThat(first.description()).hasSize(500);
        assertThat(first.thumbnailUrl()).isEqualTo("https://i.ytimg.com/abc.jpg");
        assertThat(first.durationSeconds()).isEqualTo(245);

        SourceCandidate second = videos.get(1);
        assertThat(second.durationSeconds()).isNull();
        assertThat(second.thumbnailUrl()).isNull();
        assertThat(second.description()).isEmpty();
    }

    @Test
    void emptyOutputYieldsNoVideos() {
        YtDlpVideoSearchAdapter adapter = new YtDlpVideoSearchAdapter(new ScraperProperties(), new ObjectMapper());
        assertThat(adapter.parseOutput("  ")).isEmpty();
        assertThat(adapter.parseOutput(null)).isEmpty();
    }

    @Test
    void missingBinaryIsReportedAsUnavailable() {
        ScraperProperties properties = new ScraperProperties();
        properties.getVideo().setCommand("yt-dlp-binary-that-does-not-exist");
        YtDlpVideoSearchAdapter adapter = new YtDlpVideoSearchAdapter(properties, new ObjectMapper());

        assertThatThrownBy(() -> adapter.search("steam boiler", 3))
            .isInstanceOf(ContentSourceException.class)
            .satisfies(e -> assertThat(((ContentSourceException) e).getErrorCode())
                .isEqualTo(ContentSourceRegistry.ERROR_UNAVAILABLE));
    }
}
