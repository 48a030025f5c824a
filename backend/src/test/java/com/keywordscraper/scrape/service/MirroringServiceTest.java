package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.MirrorResult;
import com.keywordscraper.scrape.source.ContentSourceException;
import com.keywordscraper.scrape.source.VideoDownloader;
import com.keywordscraper.scrape.storage.ObjectStorageService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MirroringServiceTest {

    @Mock
    private ObjectStorageService storage;
    @Mock
    private VideoDownloader videoDownloader;

    @Test
    void unavailableStorageSkipsEverything() {
        when(storage.isAvailable()).thenReturn(false);

        MirrorResult result = new MirroringService(storage, videoDownloader)
            .mirror(1L, "https://img.example/a.jpg", ContentType.IMAGE, "pump", "task-1");

        assertThat(result.isStored()).isFalse();
        assertThat(result.errorCode()).isEqualTo("storage_unavailable");
        verifyNoInteractions(videoDownloader);
    }

    @Test
    void imagesAreUploadedFromTheirUrl() {
        when(storage.isAvailable()).thenReturn(true);
        when(storage.uploadFromUrl("https://img.example/a.jpg", "pump", ContentType.IMAGE, "task-1", 1L))
            .thenReturn(MirrorResult.stored(null, "images/item_1_pump.jpg", 42));

        MirrorResult result = new MirroringService(storage, videoDownloader)
            .mirror(1L, "https://img.example/a.jpg", ContentType.IMAGE, "pump", "task-1");

        assertThat(result.storageKey()).isEqualTo("images/item_1_pump.jpg");
        verifyNoInteractions(videoDownloader);
    }

    @Test
    void videosAreDownloadedUploadedAndCleanedUp() throws Exception {
        Path file = Path.of("/tmp/video-test.mp4");
        when(storage.isAvailable()).thenReturn(true);
        when(videoDownloader.download("https://video.example/v")).thenReturn(file);
        when(storage.uploadFile(file, "https://video.example/v", "pump", ContentType.VIDEO, "task-1", 2L))
            .thenReturn(MirrorResult.stored(null, "videos/item_2_pump.mp4", 1000));

        MirrorResult result = new MirroringService(storage, videoDownloader)
            .mirror(2L, "https://video.example/v", ContentType.VIDEO, "pump", "task-1");

        assertThat(result.isStored()).isTrue();
        verify(videoDownloader).cleanup(file);
    }

    @Test
    void failedVideoDownloadIsReportedNotThrown() throws Exception {
        when(storage.isAvailable()).thenReturn(true);
        when(videoDownloader.download("https://video.example/v"))
            .thenThrow(new ContentSourceException("timeout", "yt-dlp timed out"));

        MirrorResult result = new MirroringService(storage, videoDownloader)
            .mirror(2L, "https://video.example/v", ContentType.VIDEO, "pump", "task-1");

        assertThat(result.errorCode()).isEqualTo(MirroringService.ERROR_DOWNLOAD_FAILED);
        assertThat(result.errorMessage()).startsWith("timeout");
        verify(videoDownloader).cleanup(null);
    }

    @Test
    void discardDeletesTheObject() {
        when(storage.delete("images/item_1_pump.jpg")).thenReturn(true);

        new MirroringService(storage, videoDownloader).discard("images/item_1_pump.jpg");

        verify(storage).delete("images/item_1_pump.jpg");
    }
}
