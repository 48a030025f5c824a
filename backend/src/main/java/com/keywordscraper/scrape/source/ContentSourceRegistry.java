package com.keywordscraper.scrape.source;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.SourceCandidate;
import com.keywordscraper.scrape.model.SourceSearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps each content type to the adapter that searches it. Adding a source means
 * registering another {@link ContentSourceAdapter} bean.
 */
@Component
public class ContentSourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContentSourceRegistry.class);

    public static final String ERROR_SOURCE = "source_error";
    public static final String ERROR_UNAVAILABLE = "source_unavailable";

    private final Map<ContentType, ContentSourceAdapter> adapters = new EnumMap<>(ContentType.class);

    public ContentSourceRegistry(List<ContentSourceAdapter> adapters) {
        for (ContentSourceAdapter adapter : adapters) {
            ContentSourceAdapter previous = this.adapters.put(adapter.contentType(), adapter);
            if (previous != null) {
                throw new IllegalStateException(
                    "Duplicate content source for " + adapter.contentType() + ": "
                        + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName()
                );
            }
        }
    }

    public Set<ContentType> supportedTypes() {
        return adapters.isEmpty() ? EnumSet.noneOf(ContentType.class) : EnumSet.copyOf(adapters.keySet());
    }

    public SourceRun openRun(Collection<ContentType> enabledTypes) {
        return new SourceRun(enabledTypes);
    }

    /**
     * Adapter access for one scrape run. Closing the run closes every adapter it
     * searched with.
     */
    public final class SourceRun implements AutoCloseable {
        private final Set<ContentType> enabledTypes;
        private final Set<ContentType> used = EnumSet.noneOf(ContentType.class);

        private SourceRun(Collection<ContentType> enabledTypes) {
            this.enabledTypes = enabledTypes == null || enabledTypes.isEmpty()
                ? EnumSet.noneOf(ContentType.class)
                : EnumSet.copyOf(enabledTypes);
        }

        /**
         * Never throws. Adapter failures come back as an unsuccessful result with no candidates.
         */
        public SourceSearchResult search(ContentType contentType, String keyword, int maxResults) {
            if (!enabledTypes.contains(contentType)) {
                return SourceSearchResult.ok(contentType, keyword, List.of());
            }
            ContentSourceAdapter adapter = adapters.get(contentType);
            if (adapter == null) {
                return SourceSearchResult.failed(contentType, keyword, ERROR_UNAVAILABLE, "No adapter for " + contentType.key());
            }
            used.add(contentType);
            try {
                List<SourceCandidate> candidates = adapter.search(keyword, maxResults);
                if (candidates == null) {
                    return SourceSearchResult.ok(contentType, keyword, List.of());
                }
                if (candidates.size() > maxResults) {
                    candidates = candidates.subList(0, maxResults);
                }
                return SourceSearchResult.ok(contentType, keyword, candidates);
            } catch (ContentSourceException e) {
                log.warn("{} search failed for '{}': {} {}", contentType.key(), keyword, e.getErrorCode(), e.getMessage());
                return SourceSearchResult.failed(contentType, keyword, e.getErrorCode(), e.getMessage());
            } catch (RuntimeException e) {
                log.warn("{} search failed for '{}'", contentType.key(), keyword, e);
                return SourceSearchResult.failed(contentType, keyword, ERROR_SOURCE, e.getMessage());
            }
        }

        @Override
        public void close() {
            for (ContentType type : used) {
                ContentSourceAdapter adapter = adapters.get(type);
                try {
                    adapter.close();
                } catch (RuntimeException e) {
                    log.warn("Failed to close {} source", type.key(), e);
                }
            }
            used.clear();
        }
    }
}
