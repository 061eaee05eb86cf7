package com.iecore.chunk;

import com.iecore.document.IeDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ChunkTextExtractorTest {

    private final ChunkTextExtractor extractor = new ChunkTextExtractor();

    @Test
    void testExtractUsesCharacterOffsets() {
        IeDocument document = new IeDocument("d", "Hello,  big world!");
        document.setTokens(List.of("Hello", ",", "big", "world", "!"));
        document.setOffsets(List.of(0, 5, 8, 12, 17));

        assertEquals("Hello,", extractor.extract(document, 0, 2));
        assertEquals("big world!", extractor.extract(document, 2, 5));
    }

    @Test
    void testFallbackToJoinedTokensWithoutOffsets() {
        IeDocument document = new IeDocument("d", "Hello big world");
        document.setTokens(List.of("Hello", "big", "world"));

        assertEquals("big world", extractor.extract(document, 1, 3));
    }

    @Test
    void testFallbackWhenOffsetsExceedText() {
        IeDocument document = new IeDocument("d", "short");
        document.setTokens(List.of("a", "b"));
        document.setOffsets(List.of(0, 40));

        assertEquals("a", extractor.extract(document, 0, 1));
        assertEquals("a b", extractor.extract(document, 0, 2));
    }

    @Test
    void testEmptyRange() {
        IeDocument document = new IeDocument("d", "x");
        document.setTokens(List.of("x"));

        assertEquals("", extractor.extract(document, 1, 1));
    }
}
