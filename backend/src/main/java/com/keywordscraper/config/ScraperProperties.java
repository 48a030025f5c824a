package com.keywordscraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/115.0.0.0 Safari/537.36";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private int perHostDelayMs = 250;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 4000;
    private Limits limits = new Limits();
    private Storage storage = new Storage();
    private Document document = new Document();
    private Image image = new Image();
    private Video video = new Video();
    private Api api = new Api();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getPerHostDelayMs() {
        return Math.max(0, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(0, perHostDelayMs);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return requestRetryBaseDelayMs;
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = requestRetryBaseDelayMs;
    }

    public int getRequestRetryMaxDelayMs() {
        return requestRetryMaxDelayMs;
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = requestRetryMaxDelayMs;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Document getDocument() {
        return document;
    }

    public void setDocument(Document document) {
        this.document = document;
    }

    public Image getImage() {
        return image;
    }

    public void setImage(Image image) {
        this.image = image;
    }

    public Video getVideo() {
        return video;
    }

    public void setVideo(Video video) {
        this.video = video;
    }

    public Api getApi() {
        return api;
    }

    public void setApi(Api api) {
        this.api = api;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Limits {
        private int maxResultsPerKeyword = 2;
        private int maxDocumentResultsPerKeyword = 2;
        private int searchMultiplier = 3;

        public int getMaxResultsPerKeyword() {
            return Math.max(1, maxResultsPerKeyword);
        }

        public void setMaxResultsPerKeyword(int maxResultsPerKeyword) {
            this.maxResultsPerKeyword = Math.max(1, maxResultsPerKeyword);
        }

        public int getMaxDocumentResultsPerKeyword() {
            return Math.max(1, maxDocumentResultsPerKeyword);
        }

        public void setMaxDocumentResultsPerKeyword(int maxDocumentResultsPerKeyword) {
            this.maxDocumentResultsPerKeyword = Math.max(1, maxDocumentResultsPerKeyword);
        }

        public int getSearchMultiplier() {
            return Math.max(1, searchMultiplier);
        }

        public void setSearchMultiplier(int searchMultiplier) {
            this.searchMultiplier = Math.max(1, searchMultiplier);
        }
    }

    public static class Storage {
        private String endpoint;
        private String region = "auto";
        private String bucket;
        private String accessKeyId;
        private String secretAccessKey;
        private String publicUrl;
        private boolean pathStyleAccess = true;
        private long presignExpirySeconds = 604800;
        private long downloadExpirySeconds = 86400;
        private int maxDownloadSizeMb = 500;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getRegion() {
            return region == null || region.isBlank() ? "auto" : region.trim();
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getBucket() {
            return bucket;
        }

        public void setBucket(String bucket) {
            this.bucket = bucket;
        }

        public String getAccessKeyId() {
            return accessKeyId;
        }

        public void setAccessKeyId(String accessKeyId) {
            this.accessKeyId = accessKeyId;
        }

        public String getSecretAccessKey() {
            return secretAccessKey;
        }

        public void setSecretAccessKey(String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
        }

        public String getPublicUrl() {
            return publicUrl;
        }

        public void setPublicUrl(String publicUrl) {
            this.publicUrl = publicUrl;
        }

        public boolean isPathStyleAccess() {
            return pathStyleAccess;
        }

        public void setPathStyleAccess(boolean pathStyleAccess) {
            this.pathStyleAccess = pathStyleAccess;
        }

        public long getPresignExpirySeconds() {
            return Math.max(60, presignExpirySeconds);
        }

        public void setPresignExpirySeconds(long presignExpirySeconds) {
            this.presignExpirySeconds = presignExpirySeconds;
        }

        public long getDownloadExpirySeconds() {
            return Math.max(60, downloadExpirySeconds);
        }

        public void setDownloadExpirySeconds(long downloadExpirySeconds) {
            this.downloadExpirySeconds = downloadExpirySeconds;
        }

        public int getMaxDownloadSizeMb() {
            return Math.max(1, maxDownloadSizeMb);
        }

        public void setMaxDownloadSizeMb(int maxDownloadSizeMb) {
            this.maxDownloadSizeMb = Math.max(1, maxDownloadSizeMb);
        }

        public long maxDownloadBytes() {
            return getMaxDownloadSizeMb() * 1024L * 1024L;
        }

        public boolean isConfigured() {
            return notBlank(bucket) && notBlank(accessKeyId) && notBlank(secretAccessKey);
        }

        private static boolean notBlank(String value) {
            return value != null && !value.isBlank();
        }
    }

    public static class Document {
        private String apiKey;
        private String baseUrl = "https://api.exa.ai";
        private List<String> queryTemplates = new ArrayList<>(List.of(
            "%s filetype:pdf",
            "%s PDF",
            "%s PDF document"
        ));

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public List<String> getQueryTemplates() {
            return queryTemplates;
        }

        public void setQueryTemplates(List<String> queryTemplates) {
            this.queryTemplates = queryTemplates == null ? new ArrayList<>() : queryTemplates;
        }
    }

    public static class Image {
        private String baseUrl = "https://www.bing.com";
        private int pageSize = 35;
        private int maxPages = 10;
        private List<String> excludedDomains = new ArrayList<>(List.of(
            "gamespot.com", "steam.com", "steampowered.com", "gog.com",
            "epicgames.com", "twitch.tv", "youtube.com", "facebook.com",
            "twitter.com", "x.com", "instagram.com", "reddit.com",
            "imgur.com", "pinterest.com", "flickr.com", "deviantart.com",
            "tumblr.com", "9gag.com", "memegenerator.net"
        ));

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getPageSize() {
            return Math.max(1, pageSize);
        }

        public void setPageSize(int pageSize) {
            this.pageSize = Math.max(1, pageSize);
        }

        public int getMaxPages() {
            return Math.max(1, maxPages);
        }

        public void setMaxPages(int maxPages) {
            this.maxPages = Math.max(1, maxPages);
        }

        public List<String> getExcludedDomains() {
            return excludedDomains;
        }

        public void setExcludedDomains(List<String> excludedDomains) {
            this.excludedDomains = excludedDomains == null ? new ArrayList<>() : excludedDomains;
        }
    }

    public static class Video {
        private String command = "yt-dlp";
        private int searchTimeoutSeconds = 30;
        private int downloadTimeoutSeconds = 600;
        private int maxHeight = 720;

        public String getCommand() {
            return command == null || command.isBlank() ? "yt-dlp" : command.trim();
        }

        public void setCommand(String command) {
            this.command = command;
        }

        public int getSearchTimeoutSeconds() {
            return Math.max(1, searchTimeoutSeconds);
        }

        public void setSearchTimeoutSeconds(int searchTimeoutSeconds) {
            this.searchTimeoutSeconds = searchTimeoutSeconds;
        }

        public int getDownloadTimeoutSeconds() {
            return Math.max(1, downloadTimeoutSeconds);
        }

        public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) {
            this.downloadTimeoutSeconds = downloadTimeoutSeconds;
        }

        public int getMaxHeight() {
            return Math.max(144, maxHeight);
        }

        public void setMaxHeight(int maxHeight) {
            this.maxHeight = maxHeight;
        }
    }

    public static class Api {
        private int defaultItemLimit = 50;
        private int maxItemLimit = 500;

        public int getDefaultItemLimit() {
            return Math.max(1, defaultItemLimit);
        }

        public void setDefaultItemLimit(int defaultItemLimit) {
            this.defaultItemLimit = Math.max(1, defaultItemLimit);
        }

        public int getMaxItemLimit() {
            return Math.max(1, maxItemLimit);
        }

        public void setMaxItemLimit(int maxItemLimit) {
            this.maxItemLimit = Math.max(1, maxItemLimit);
        }
    }
}
