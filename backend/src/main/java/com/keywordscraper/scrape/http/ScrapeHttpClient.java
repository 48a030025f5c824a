package com.keywordscraper.scrape.http;

import com.keywordscraper.config.ScraperProperties;
import com.keywordscraper.scrape.model.HttpFetchResult;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Shared outbound HTTP client for search sources, mirroring and downloads.
 * Applies a per-host delay, bounded retries on 408/429/5xx, a request timeout
 * and an optional response size cap. Failures are reported through
 * {@link HttpFetchResult#errorCode()} and never thrown.
 */
@Service
public class ScrapeHttpClient {
    public static final String ERROR_TIMEOUT = "timeout";
    public static final String ERROR_IO = "io_error";
    public static final String ERROR_INVALID_URL = "invalid_url";
    public static final String ERROR_BODY_TOO_LARGE = "body_too_large";
    public static final String ERROR_INTERRUPTED = "interrupted";

    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);
    private static final int BUFFER_SIZE = 8192;

    private final ScraperProperties properties;
    private final HttpClient client;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostNextAllowed = new ConcurrentHashMap<>();

    public ScrapeHttpClient(ScraperProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Map.of(), -1);
    }

    public HttpFetchResult get(String url, String acceptHeader, long maxBytes) {
        return get(url, acceptHeader, Map.of(), maxBytes);
    }

    public HttpFetchResult get(String url, String acceptHeader, Map<String, String> headers, long maxBytes) {
        return send(url, "GET", acceptHeader, headers, null, maxBytes);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers) {
        return send(url, "POST", "application/json", headers, jsonBody == null ? "" : jsonBody, -1);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        Map<String, String> headers,
        String body,
        long maxBytes
    ) {
        int maxAttempts = Math.max(1, 1 + properties.getRequestMaxRetries());
        HttpFetchResult lastResult = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lastResult = executeOnce(url, method, acceptHeader, headers, body, maxBytes);
            if (!shouldRetry(lastResult) || attempt >= maxAttempts) {
                return lastResult;
            }
            if (!sleepBackoff(attempt)) {
                return lastResult;
            }
        }
        return lastResult;
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String acceptHeader,
        Map<String, String> headers,
        String body,
        long maxBytes
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, ERROR_INVALID_URL, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        try {
            enforcePerHostDelay(host);

            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (headers != null) {
                headers.forEach(builder::header);
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<InputStream> response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() == 403 || response.statusCode() == 429) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            long declaredLength = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
            byte[] bytes;
            try (InputStream stream = response.body()) {
                if (maxBytes > 0 && declaredLength > maxBytes) {
                    return tooLarge(url, startedAt, declaredLength, maxBytes);
                }
                bytes = readBounded(stream, maxBytes);
            }
            if (bytes == null) {
                return tooLarge(url, startedAt, -1, maxBytes);
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                bytes,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, ERROR_TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, ERROR_IO, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, ERROR_INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    /**
     * Returns null when the stream holds more than {@code maxBytes}.
     */
    private byte[] readBounded(InputStream stream, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = stream.read(buffer)) != -1) {
            total += read;
            if (maxBytes > 0 && total > maxBytes) {
                return null;
            }
            out.write(buffer, 0, read);
        }
        return out.toByteArray();
    }

    private HttpFetchResult tooLarge(String url, Instant startedAt, long size, long maxBytes) {
        String detail = size > 0
            ? "response of " + size + " bytes exceeds limit of " + maxBytes
            : "response exceeds limit of " + maxBytes + " bytes";
        return errorResult(url, startedAt, ERROR_BODY_TOO_LARGE, detail);
    }

    private boolean shouldRetry(HttpFetchResult result) {
        if (result == null) {
            return false;
        }
        String errorCode = result.errorCode();
        if (errorCode != null && !errorCode.isBlank()) {
            return !errorCode.equals(ERROR_INVALID_URL)
                && !errorCode.equals(ERROR_INTERRUPTED)
                && !errorCode.equals(ERROR_BODY_TOO_LARGE);
        }
        int status = result.statusCode();
        return status == 408 || status == 429 || status >= 500;
    }

    private boolean sleepBackoff(int attempt) {
        int baseDelayMs = properties.getRequestRetryBaseDelayMs();
        if (baseDelayMs <= 0) {
            return true;
        }
        int maxDelayMs = properties.getRequestRetryMaxDelayMs();
        long delay = (long) baseDelayMs * (1L << Math.max(0, attempt - 1));
        if (maxDelayMs > 0) {
            delay = Math.min(delay, maxDelayMs);
        }
        if (delay <= 0) {
            return true;
        }
        long jitter = ThreadLocalRandom.current().nextLong(Math.max(1L, delay / 2));
        long sleepMs = (delay / 2) + jitter;
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void enforcePerHostDelay(String host) throws InterruptedException {
        int delayMs = properties.getPerHostDelayMs();
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant now = Instant.now();
            Instant allowedAt = hostNextAllowed.getOrDefault(host, now);
            if (allowedAt.isAfter(now)) {
                long sleepMs = Duration.between(now, allowedAt).toMillis();
                if (sleepMs > 0) {
                    Thread.sleep(sleepMs);
                }
            }
            hostNextAllowed.put(host, Instant.now().plusMillis(delayMs));
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostNextAllowed.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostNextAllowed.put(host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
