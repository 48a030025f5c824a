package com.keywordscraper.scrape.util;

import com.keywordscraper.scrape.model.ContentType;

import java.util.Locale;

/**
 * File naming and media type rules shared by object storage and downloads.
 */
public final class MediaFiles {
    private static final int MAX_KEYWORD_CHARS = 50;

    private MediaFiles() {
    }

    public static String safeKeyword(String keyword) {
        if (keyword == null) {
            return "";
        }
        String trimmed = keyword.length() > MAX_KEYWORD_CHARS ? keyword.substring(0, MAX_KEYWORD_CHARS) : keyword;
        StringBuilder out = new StringBuilder(trimmed.length());
        for (char c : trimmed.toCharArray()) {
            out.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' ? c : '_');
        }
        return out.toString();
    }

    public static String extension(ContentType type, String url) {
        switch (type) {
            case DOCUMENT:
                return ".pdf";
            case VIDEO:
                return ".mp4";
            case IMAGE:
                return imageExtension(url);
            default:
                return ".bin";
        }
    }

    public static String mediaType(ContentType type, String url) {
        switch (type) {
            case DOCUMENT:
                return "application/pdf";
            case VIDEO:
                return "video/mp4";
            case IMAGE:
                return imageMediaType(imageExtension(url));
            default:
                return "application/octet-stream";
        }
    }

    /**
     * Picks an image extension from the URL path, falling back to the
     * response content type and finally JPEG.
     */
    public static String imageExtension(String url, String responseContentType) {
        String lowerUrl = stripQuery(url).toLowerCase(Locale.ROOT);
        String lowerType = responseContentType == null ? "" : responseContentType.toLowerCase(Locale.ROOT);
        if (lowerUrl.endsWith(".png") || lowerType.contains("png")) {
            return ".png";
        }
        if (lowerUrl.endsWith(".gif") || lowerType.contains("gif")) {
            return ".gif";
        }
        if (lowerUrl.endsWith(".webp") || lowerType.contains("webp")) {
            return ".webp";
        }
        return ".jpg";
    }

    public static String imageExtension(String url) {
        return imageExtension(url, null);
    }

    public static String imageMediaType(String extension) {
        switch (extension) {
            case ".png":
                return "image/png";
            case ".gif":
                return "image/gif";
            case ".webp":
                return "image/webp";
            default:
                return "image/jpeg";
        }
    }

    public static String downloadFilename(long itemId, String keyword, String extension) {
        return itemId + "_" + safeKeyword(keyword) + extension;
    }

    public static String stripQuery(String url) {
        if (url == null) {
            return "";
        }
        int cut = url.length();
        int query = url.indexOf('?');
        if (query >= 0) {
            cut = Math.min(cut, query);
        }
        int fragment = url.indexOf('#');
        if (fragment >= 0) {
            cut = Math.min(cut, fragment);
        }
        return url.substring(0, cut);
    }
}
