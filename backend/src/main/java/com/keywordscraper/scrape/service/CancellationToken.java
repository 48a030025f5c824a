package com.keywordscraper.scrape.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation marker for one task. The orchestrator checks it at
 * keyword boundaries only.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call flipped the marker
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
