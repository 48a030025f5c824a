package com.keywordscraper.scrape.storage;

import com.keywordscraper.scrape.model.ContentType;
import com.keywordscraper.scrape.util.HashUtils;
import com.keywordscraper.scrape.util.MediaFiles;

public final class StorageKeys {
    private static final int URL_HASH_CHARS = 8;

    private StorageKeys() {
    }

    /**
     * {@code {dir}/item_{id}_{keyword}{ext}} when the item id is known, otherwise
     * {@code {dir}/{keyword}_{type}_{md5 prefix of url}{ext}}.
     */
    public static String objectKey(ContentType contentType, String keyword, String sourceUrl, Long itemId, String extension) {
        String safeKeyword = MediaFiles.safeKeyword(keyword);
        String directory = contentType.storageDirectory();
        if (itemId != null) {
            return directory + "/item_" + itemId + "_" + safeKeyword + extension;
        }
        String urlHash = HashUtils.md5Hex(sourceUrl == null ? "" : sourceUrl).substring(0, URL_HASH_CHARS);
        return directory + "/" + safeKeyword + "_" + contentType.key() + "_" + urlHash + extension;
    }

    public static String filename(String key) {
        int slash = key.lastIndexOf('/');
        return slash >= 0 ? key.substring(slash + 1) : key;
    }
}
