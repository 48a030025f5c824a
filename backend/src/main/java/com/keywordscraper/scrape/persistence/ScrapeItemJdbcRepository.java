package com.keywordscraper.scrape.persistence;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.model.NewScrapedItem;
import com.keywordscraper.scrape.model.ScrapedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class ScrapeItemJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ScrapeItemJdbcRepository.class);
    private static final int MAX_TITLE_CHARS = 1000;

    private static final String ITEM_COLUMNS = """
        id, keyword, url, content_type, title, description, file_size, content_hash,
        storage_key, storage_url, task_id, source_file, created_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public ScrapeItemJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public long insertItem(NewScrapedItem item, Instant createdAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("keyword", item.keyword())
            .addValue("url", item.url())
            .addValue("contentType", item.contentType().key())
            .addValue("title", truncate(item.title(), MAX_TITLE_CHARS))
            .addValue("description", item.description())
            .addValue("fileSize", item.fileSize())
            .addValue("contentHash", item.contentHash())
            .addValue("taskId", item.taskId())
            .addValue("sourceFile", item.sourceFile())
            .addValue("createdAt", toTimestamp(createdAt == null ? Instant.now() : createdAt));

        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO scraped_items (
                    keyword,
                    url,
                    content_type,
                    title,
                    description,
                    file_size,
                    content_hash,
                    task_id,
                    source_file,
                    created_at
                )
                VALUES (
                    :keyword,
                    :url,
                    :contentType,
                    :title,
                    :description,
                    :fileSize,
                    :contentHash,
                    :taskId,
                    :sourceFile,
                    :createdAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert scraped item for url " + item.url());
        }
        return key.longValue();
    }

    public void attachStorage(long itemId, String storageKey, String storageUrl) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", itemId)
            .addValue("storageKey", storageKey)
            .addValue("storageUrl", storageUrl);
        jdbc.update(
            """
                UPDATE scraped_items
                SET storage_key = :storageKey,
                    storage_url = :storageUrl
                WHERE id = :id
                """,
            params
        );
    }

    public Set<String> findUrlsByContentType(ContentType contentType) {
        Set<String> urls = new LinkedHashSet<>();
        jdbc.query(
            "SELECT url FROM scraped_items WHERE content_type = :contentType",
            new MapSqlParameterSource("contentType", contentType.key()),
            rs -> {
                String url = rs.getString("url");
                if (url != null) {
                    urls.add(url);
                }
            }
        );
        return urls;
    }

    /**
     * Keywords from {@code keywords} that already have at least one item attributed to
     * {@code sourceFile}.
     */
    public Set<String> findKeywordsWithItemsForSourceFile(String sourceFile, Collection<String> keywords) {
        Set<String> found = new LinkedHashSet<>();
        if (sourceFile == null || keywords == null || keywords.isEmpty()) {
            return found;
        }
        jdbc.query(
            """
                SELECT DISTINCT keyword
                FROM scraped_items
                WHERE source_file = :sourceFile
                  AND keyword IN (:keywords)
                """,
            new MapSqlParameterSource()
                .addValue("sourceFile", sourceFile)
                .addValue("keywords", List.copyOf(keywords)),
            rs -> {
                found.add(rs.getString("keyword"));
            }
        );
        return found;
    }

    public long countItems() {
        Long value = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM scraped_items", Long.class);
        return value == null ? 0 : value;
    }

    public Map<String, Long> countByContentType() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (ContentType type : ContentType.values()) {
            counts.put(type.key(), 0L);
        }
        jdbc.query(
            """
                SELECT content_type, COUNT(*) AS total
                FROM scraped_items
                GROUP BY content_type
                """,
            new MapSqlParameterSource(),
            rs -> {
                String type = rs.getString("content_type");
                if (type != null) {
                    counts.put(type, rs.getLong("total"));
                }
            }
        );
        return counts;
    }

    public int deleteAllItems() {
        int deleted = jdbc.update("DELETE FROM scraped_items", new MapSqlParameterSource());
        log.info("Deleted {} scraped items", deleted);
        return deleted;
    }

    /**
     * Newest first. A non-positive limit returns every item of the task from {@code offset} on.
     */
    public List<ScrapedItem> findItemsByTask(String taskId, int offset, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("taskId", taskId)
            .addValue("offset", Math.max(0, offset));
        String paging = "OFFSET :offset ROWS";
        if (limit > 0) {
            params.addValue("limit", limit);
            paging = "LIMIT :limit OFFSET :offset";
        }
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + """
                FROM scraped_items
                WHERE task_id = :taskId
                ORDER BY created_at DESC, id DESC
                """ + paging,
            params,
            itemRowMapper()
        );
    }

    public long countItemsByTask(String taskId) {
        Long value = jdbc.queryForObject(
            "SELECT COUNT(*) FROM scraped_items WHERE task_id = :taskId",
            new MapSqlParameterSource("taskId", taskId),
            Long.class
        );
        return value == null ? 0 : value;
    }

    /**
     * Newest first. A non-positive limit returns every item from {@code offset} on.
     */
    public List<ScrapedItem> findAllItems(int offset, int limit) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("offset", Math.max(0, offset));
        String paging = "OFFSET :offset ROWS";
        if (limit > 0) {
            params.addValue("limit", limit);
            paging = "LIMIT :limit OFFSET :offset";
        }
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + """
                FROM scraped_items
                ORDER BY created_at DESC, id DESC
                """ + paging,
            params,
            itemRowMapper()
        );
    }

    public ScrapedItem findItemById(long itemId) {
        List<ScrapedItem> rows = jdbc.query(
            "SELECT " + ITEM_COLUMNS + " FROM scraped_items WHERE id = :id",
            new MapSqlParameterSource("id", itemId),
            itemRowMapper()
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public List<ScrapedItem> findItemsByTaskAndType(String taskId, ContentType contentType) {
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + """
                FROM scraped_items
                WHERE task_id = :taskId
                  AND content_type = :contentType
                ORDER BY created_at, id
                """,
            new MapSqlParameterSource()
                .addValue("taskId", taskId)
                .addValue("contentType", contentType.key()),
            itemRowMapper()
        );
    }

    public List<String> findSourceFilesForTask(String taskId) {
        return jdbc.queryForList(
            """
                SELECT DISTINCT source_file
                FROM scraped_items
                WHERE task_id = :taskId
                  AND source_file IS NOT NULL
                ORDER BY source_file
                """,
            new MapSqlParameterSource("taskId", taskId),
            String.class
        );
    }

    public String findMostRecentTaskForSourceFile(String sourceFile) {
        List<String> rows = jdbc.queryForList(
            """
                SELECT task_id
                FROM scraped_items
                WHERE source_file = :sourceFile
                  AND task_id IS NOT NULL
                ORDER BY created_at DESC, id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("sourceFile", sourceFile),
            String.class
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public Set<String> findKeywordsForSourceFileAndTask(String sourceFile, String taskId) {
        return new LinkedHashSet<>(jdbc.queryForList(
            """
                SELECT DISTINCT keyword
                FROM scraped_items
                WHERE source_file = :sourceFile
                  AND task_id = :taskId
                """,
            new MapSqlParameterSource()
                .addValue("sourceFile", sourceFile)
                .addValue("taskId", taskId),
            String.class
        ));
    }

    /**
     * Items attributed to {@code sourceFile}, oldest first. An empty keyword set
     * applies no keyword filter.
     */
    public List<ScrapedItem> findItemsForSourceFile(String sourceFile, Collection<String> keywords) {
        MapSqlParameterSource params = new MapSqlParameterSource("sourceFile", sourceFile);
        String keywordFilter = "";
        if (keywords != null && !keywords.isEmpty()) {
            params.addValue("keywords", List.copyOf(keywords));
            keywordFilter = "  AND keyword IN (:keywords)\n";
        }
        return jdbc.query(
            "SELECT " + ITEM_COLUMNS + """
                FROM scraped_items
                WHERE source_file = :sourceFile
                """ + keywordFilter + "ORDER BY created_at, id",
            params,
            itemRowMapper()
        );
    }

    private RowMapper<ScrapedItem> itemRowMapper() {
        return (rs, rowNum) -> {
            long fileSize = rs.getLong("file_size");
            Long fileSizeValue = rs.wasNull() ? null : fileSize;
            return new ScrapedItem(
                rs.getLong("id"),
                rs.getString("keyword"),
                rs.getString("url"),
                parseContentType(rs.getString("content_type")),
                rs.getString("title"),
                rs.getString("description"),
                fileSizeValue,
                rs.getString("content_hash"),
                rs.getString("storage_key"),
                rs.getString("storage_url"),
                rs.getString("task_id"),
                rs.getString("source_file"),
                toInstant(rs.getTimestamp("created_at"))
            );
        };
    }

    private ContentType parseContentType(String raw) {
        try {
            return ContentType.parse(raw);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown content_type in scraped_items: {}", raw);
            return null;
        }
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }

    private String truncate(String value, int maxChars) {
        if (value == null || value.length() <= maxChars) {
            return value;
        }
        return value.substring(0, maxChars);
    }
}
