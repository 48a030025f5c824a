package com.keywordscraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskStatus {
    PROCESSING("processing"),
    COMPLETED("completed"),
    CANCELLED("cancelled"),
    ERROR("error");

    private final String key;

    TaskStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isTerminal() {
        return this != PROCESSING;
    }
}
