package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.KeywordBatch;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads keyword lists from uploaded CSV files. The first column of every row is a
 * keyword; blank cells are dropped. Keywords are deduplicated across files in order
 * of first appearance and each is attributed to the last file it appears in.
 * Keywords longer than the keyword column are skipped and over-long file names
 * fail the upload; neither is ever truncated.
 */
@Component
public class KeywordFileParser {
    private static final Logger log = LoggerFactory.getLogger(KeywordFileParser.class);
    static final int MAX_KEYWORD_CHARS = 500;
    static final int MAX_FILENAME_CHARS = 500;

    public record Upload(String filename, byte[] content) {}

    public KeywordBatch parse(List<Upload> uploads) {
        if (uploads == null || uploads.isEmpty()) {
            throw new IllegalArgumentException("No files provided");
        }
        Set<String> keywords = new LinkedHashSet<>();
        Map<String, String> keywordToSourceFile = new LinkedHashMap<>();
        List<String> files = new ArrayList<>();
        for (Upload upload : uploads) {
            String filename = upload.filename();
            if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
                throw new IllegalArgumentException("File " + filename + " is not a CSV file");
            }
            if (filename.length() > MAX_FILENAME_CHARS) {
                throw new IllegalArgumentException("File name exceeds " + MAX_FILENAME_CHARS + " characters");
            }
            List<String> fileKeywords = readFirstColumn(filename, upload.content());
            for (String keyword : fileKeywords) {
                keywords.add(keyword);
                keywordToSourceFile.put(keyword, filename);
            }
            files.add(filename);
            log.info("Read {} keywords from {}", fileKeywords.size(), filename);
        }
        if (keywords.isEmpty()) {
            throw new IllegalArgumentException("No keywords found in uploaded files");
        }
        return new KeywordBatch(new ArrayList<>(keywords), keywordToSourceFile, files);
    }

    private List<String> readFirstColumn(String filename, byte[] content) {
        List<String> out = new ArrayList<>();
        if (content == null || content.length == 0) {
            return out;
        }
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();
        try (Reader reader = new InputStreamReader(new ByteArrayInputStream(stripBom(content)), StandardCharsets.UTF_8);
             CSVParser parser = format.parse(reader)) {
            for (CSVRecord record : parser) {
                if (record.size() == 0) {
                    continue;
                }
                String value = record.get(0) == null ? "" : record.get(0).trim();
                if (value.isEmpty()) {
                    continue;
                }
                if (value.length() > MAX_KEYWORD_CHARS) {
                    log.warn("Skipping keyword of {} chars in {} (line {})", value.length(), filename, record.getRecordNumber());
                    continue;
                }
                out.add(value);
            }
        } catch (IOException | IllegalStateException | UncheckedIOException e) {
            throw new IllegalArgumentException("Could not read CSV file " + filename + ": " + e.getMessage(), e);
        }
        return out;
    }

    private byte[] stripBom(byte[] content) {
        if (content.length >= 3
            && (content[0] & 0xFF) == 0xEF
            && (content[1] & 0xFF) == 0xBB
            && (content[2] & 0xFF) == 0xBF) {
            byte[] out = new byte[content.length - 3];
            System.arraycopy(content, 3, out, 0, out.length);
            return out;
        }
        return content;
    }
}
