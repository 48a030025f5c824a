package com.keywordscraper.scrape.service;

import com.keywordscraper.scrape.model.KeywordBatch;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordFileParserTest {
    private final KeywordFileParser parser = new KeywordFileParser();

    @Test
    void readsFirstColumnAcrossFilesInOrder() {
        KeywordBatch batch = parser.parse(List.of(
            upload("boilers.csv", "steam drum,ignored\n\n  economizer  \n\"superheater, tube\",x\n"),
            upload("pumps.CSV", "feedwater pump\nsteam drum\n,blank first cell\n")
        ));

        assertThat(batch.keywords()).containsExactly("steam drum", "economizer", "superheater, tube", "feedwater pump");
        assertThat(batch.files()).containsExactly("boilers.csv", "pumps.CSV");
        assertThat(batch.keywordToSourceFile())
            .containsEntry("economizer", "boilers.csv")
            .containsEntry("feedwater pump", "pumps.CSV")
            .containsEntry("steam drum", "pumps.CSV");
    }

    @Test
    void stripsByteOrderMark() {
        byte[] bom = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF};
        byte[] body = "deaerator\n".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + body.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(body, 0, content, bom.length, body.length);

        KeywordBatch batch = parser.parse(List.of(new KeywordFileParser.Upload("bom.csv", content)));

        assertThat(batch.keywords()).containsExactly("deaerator");
    }

    @Test
    void rejectsNonCsvFiles() {
        assertThatThrownBy(() -> parser.parse(List.of(upload("keywords.xlsx", "pump"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not a CSV");
    }

    @Test
    void rejectsUploadsWithoutKeywords() {
        assertThatThrownBy(() -> parser.parse(List.of(upload("empty.csv", "\n  \n,\n"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No keywords");
        assertThatThrownBy(() -> parser.parse(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void skipsKeywordsLongerThanColumnLimit() {
        String atLimit = "a".repeat(KeywordFileParser.MAX_KEYWORD_CHARS);
        String tooLong = "b".repeat(KeywordFileParser.MAX_KEYWORD_CHARS + 1);

        KeywordBatch batch = parser.parse(List.of(upload("plant.csv", tooLong + "\n" + atLimit + "\npump\n")));

        assertThat(batch.keywords()).containsExactly(atLimit, "pump");
        assertThat(batch.keywordToSourceFile()).doesNotContainKey(tooLong);
    }

    @Test
    void rejectsOverlongFileNames() {
        String name = "p".repeat(KeywordFileParser.MAX_FILENAME_CHARS) + ".csv";

        assertThatThrownBy(() -> parser.parse(List.of(upload(name, "pump"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("File name exceeds");
    }

    private static KeywordFileParser.Upload upload(String name, String content) {
        return new KeywordFileParser.Upload(name, content.getBytes(StandardCharsets.UTF_8));
    }
}
