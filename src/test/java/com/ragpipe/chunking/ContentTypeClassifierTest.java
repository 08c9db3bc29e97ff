package com.ragpipe.chunking;

import org.junit.jupiter.api.Test;

import com.ragpipe.runtime.AppConfig;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ContentTypeClassifierTest {

    private final ContentTypeClassifier classifier = ContentTypeClassifier.fromConfig(new AppConfig.ChunkingConfig());

    @Test
    void shouldClassifyByExtensionFirst() {
        assertEquals("code", classifier.classify("src/App.JAVA", "plain prose"));
        assertEquals("table", classifier.classify("data/report.csv", "a,b,c"));
        assertEquals("documentation", classifier.classify("docs/guide.md", "a | b | c | d | e | f | g | h | i | j | k | l"));
    }

    @Test
    void shouldClassifyAsTableWhenPipesExceedThreshold() {
        String markdownTable = "| a | b | c |\n| 1 | 2 | 3 |\n| 4 | 5 | 6 |\n";

        assertEquals("table", classifier.classify("notes.txt", markdownTable));
    }

    @Test
    void shouldNotTreatContentAtThresholdAsTable() {
        String tenPipes = "|".repeat(10);

        assertEquals(ContentTypeProfile.DEFAULT, classifier.classify("notes.txt", tenPipes));
    }

    @Test
    void shouldFallBackToDefaultProfileWithGlobalSizes() {
        ContentTypeProfile profile = classifier.resolve("notes.txt", "just some words");

        assertEquals(ContentTypeProfile.DEFAULT, profile.name());
        assertEquals(500, profile.chunkSize());
        assertEquals(50, profile.chunkOverlap());
    }

    @Test
    void shouldClampChunkSizeToMaximum() {
        ContentTypeProfile profile = new ContentTypeProfile("code", 3000, 100, 20, 2000, null, null);

        assertEquals(2000, profile.effectiveChunkSize());
    }

    @Test
    void shouldCountNonOverlappingOccurrences() {
        assertEquals(3, ContentTypeClassifier.countOccurrences("a\tb\tc\td", "\t"));
        assertEquals(2, ContentTypeClassifier.countOccurrences("aaaa", "aa"));
        assertEquals(0, ContentTypeClassifier.countOccurrences("abc", ""));
    }
}
