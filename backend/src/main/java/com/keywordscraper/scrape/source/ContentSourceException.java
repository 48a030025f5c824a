package com.keywordscraper.scrape.source;

public class ContentSourceException extends Exception {
    private final String errorCode;

    public ContentSourceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ContentSourceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
