package com.keywordscraper.scrape.util;

import com.keywordscraper.scrape.model.ContentType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MediaFilesTest {

    @Test
    void safeKeywordReplacesSeparatorsAndTruncates() {
        assertThat(MediaFiles.safeKeyword("steam drum / level-gauge_2")).isEqualTo("steam_drum___level-gauge_2");
        assertThat(MediaFiles.safeKeyword("k".repeat(80))).hasSize(50);
        assertThat(MediaFiles.safeKeyword(null)).isEmpty();
    }

    @Test
    void extensionAndMediaTypeFollowContentType() {
        assertThat(MediaFiles.extension(ContentType.DOCUMENT, "https://a.example/x")).isEqualTo(".pdf");
        assertThat(MediaFiles.extension(ContentType.VIDEO, "https://youtu.be/x")).isEqualTo(".mp4");
        assertThat(MediaFiles.extension(ContentType.IMAGE, "https://a.example/pic.PNG?w=200")).isEqualTo(".png");
        assertThat(MediaFiles.extension(ContentType.IMAGE, "https://a.example/pic.jpeg")).isEqualTo(".jpg");
        assertThat(MediaFiles.mediaType(ContentType.IMAGE, "https://a.example/anim.gif")).isEqualTo("image/gif");
        assertThat(MediaFiles.mediaType(ContentType.DOCUMENT, "https://a.example/x.pdf")).isEqualTo("application/pdf");
        assertThat(MediaFiles.mediaType(ContentType.VIDEO, "https://youtu.be/x")).isEqualTo("video/mp4");
    }

    @Test
    void imageExtensionFallsBackToResponseContentType() {
        assertThat(MediaFiles.imageExtension("https://a.example/image?id=3", "image/webp")).isEqualTo(".webp");
        assertThat(MediaFiles.imageExtension("https://a.example/image", null)).isEqualTo(".jpg");
    }

    @Test
    void downloadFilenameCombinesIdAndKeyword() {
        assertThat(MediaFiles.downloadFilename(42, "solar panel", ".pdf")).isEqualTo("42_solar_panel.pdf");
    }

    @Test
    void stripQueryRemovesQueryAndFragment() {
        assertThat(MediaFiles.stripQuery("https://a.example/doc.pdf?x=1#page=2")).isEqualTo("https://a.example/doc.pdf");
        assertThat(MediaFiles.stripQuery("https://a.example/doc.pdf#page=2")).isEqualTo("https://a.example/doc.pdf");
        assertThat(MediaFiles.stripQuery(null)).isEmpty();
    }
}
