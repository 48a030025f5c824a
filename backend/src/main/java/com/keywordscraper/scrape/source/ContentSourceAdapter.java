package com.keywordscraper.scrape.source;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.SourceCandidate;

import java.util.List;

/**
 * Finds candidate content for a keyword from one external source.
 * <p>
 * Implementations return an empty list when nothing matches and throw only for
 * transport or availability failures. {@code maxResults} is an upper bound.
 */
public interface ContentSourceAdapter {

    ContentType contentType();

    List<SourceCandidate> search(String keyword, int maxResults) throws ContentSourceException;

    /**
     * Releases resources held for a run. Called once per run that used the adapter.
     */
    default void close() {
    }
}
