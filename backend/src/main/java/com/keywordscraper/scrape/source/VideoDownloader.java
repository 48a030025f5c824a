package com.keywordscraper.scrape.source;

import com.keywordscraper.config.ScraperProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Downloads a video page to a temporary MP4 file with yt-dlp for mirroring.
 * Callers own the returned file and must pass it to {@link #cleanup(Path)}.
 */
@Component
public class VideoDownloader {
    private static final Logger log = LoggerFactory.getLogger(VideoDownloader.class);

    private final ScraperProperties properties;

    public VideoDownloader(ScraperProperties properties) {
        this.properties = properties;
    }

    public Path download(String videoUrl) throws ContentSourceException {
        ScraperProperties.Video config = properties.getVideo();
        Path directory;
        try {
            directory = Files.createTempDirectory("scrape-video-");
        } catch (IOException e) {
            throw new ContentSourceException("io_error", "Unable to create temp directory: " + e.getMessage(), e);
        }
        List<String> command = downloadCommand(videoUrl, directory);
        ExternalCommand.Output output;
        try {
            output = ExternalCommand.run(command, config.getDownloadTimeoutSeconds());
        } catch (ContentSourceException e) {
            cleanup(directory);
            throw e;
        }
        Path file = findDownloaded(directory);
        if (output.exitCode() != 0 || file == null) {
            cleanup(directory);
            throw new ContentSourceException(
                ContentSourceRegistry.ERROR_SOURCE,
                "yt-dlp download failed for " + videoUrl + " (exit " + output.exitCode() + ")"
            );
        }
        return file;
    }

    // "--" ends option parsing so a url starting with '-' is never read as a flag
    List<String> downloadCommand(String videoUrl, Path directory) {
        ScraperProperties.Video config = properties.getVideo();
        return List.of(
            config.getCommand(),
            "-f", "best[height<=" + config.getMaxHeight() + "][ext=mp4]/best[ext=mp4]/best",
            "--merge-output-format", "mp4",
            "-o", directory.resolve("video.%(ext)s").toString(),
            "--no-playlist",
            "--quiet",
            "--no-warnings",
            "--",
            videoUrl
        );
    }

    /**
     * Deletes the downloaded file and its temporary directory. Never throws.
     */
    public void cleanup(Path path) {
        if (path == null) {
            return;
        }
        Path directory = Files.isDirectory(path) ? path : path.getParent();
        if (directory == null || !directory.getFileName().toString().startsWith("scrape-video-")) {
            deleteQuietly(path);
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            walk.sorted(Comparator.reverseOrder()).forEach(this::deleteQuietly);
        } catch (IOException e) {
            log.warn("Failed to clean up temporary video directory {}", directory, e);
        }
    }

    private Path findDownloaded(Path directory) {
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> !p.getFileName().toString().endsWith(".part"))
                .findFirst()
                .orElse(null);
        } catch (IOException e) {
            log.warn("Unable to list download directory {}", directory, e);
            return null;
        }
    }

    private void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Failed to delete {}", path, e);
        }
    }
}
