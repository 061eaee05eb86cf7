package com.iecore.chunk;

import com.iecore.document.Entity;
import com.iecore.document.EntityKind;
import com.iecore.document.EntityOccurrence;
import com.iecore.document.IeDocument;
import com.iecore.preprocess.PreprocessStage;
import com.iecore.preprocess.PreprocessState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SentenceChunkerTest {

    private static final String TEXT = "Ada was born. She lived in London. The end.";
    private static final List<String> TOKENS = List.of(
        "Ada", "was", "born", ".", "She", "lived", "in", "London", ".", "The", "end", ".");

    private final PreprocessState preprocessState = new PreprocessState();
    private IeDocument document;
    private SentenceChunker sentenceChunker;

    @BeforeEach
    void setUp() {
        document = new IeDocument("bio", TEXT);
        preprocessState.setResult(document, PreprocessStage.TOKENIZATION, TOKENS);
        document.setOffsets(offsetsOf(TEXT, TOKENS));
        preprocessState.setResult(document, PreprocessStage.SEGMENTATION, List.of(0, 4, 9, 12));
        document.addOccurrence(EntityOccurrence.of("ada", 0));
        document.addOccurrence(EntityOccurrence.of("london", 7));

        Map<String, Entity> entities = Map.of(
            "ada", new Entity("ada", "Ada Lovelace", EntityKind.PERSON),
            "london", new Entity("london", "London", EntityKind.LOCATION));
        sentenceChunker = new SentenceChunker(new ChunkBuilder(key -> Optional.ofNullable(entities.get(key))));
    }

    @Test
    @DisplayName("逐句切分，文本取自原文")
    void testBySentence() {
        List<TextChunk> chunks = sentenceChunker.bySentence(document);

        assertEquals(3, chunks.size());
        assertEquals("Ada was born.", chunks.get(0).text());
        assertEquals("She lived in London.", chunks.get(1).text());
        assertEquals("The end.", chunks.get(2).text());
        assertEquals(List.of(0, 4, 9), chunks.stream().map(TextChunk::offset).toList());
        assertEquals(3, chunks.get(1).entities().get(0).offset());
        assertTrue(chunks.get(2).entities().isEmpty());
    }

    @Test
    @DisplayName("滑动窗口生成重叠分块")
    void testOverlappingWindows() {
        List<TextChunk> chunks = sentenceChunker.slidingWindow(document, 2, 1);

        assertEquals(2, chunks.size());
        assertEquals(0, chunks.get(0).offset());
        assertEquals(9, chunks.get(0).offsetEnd());
        assertEquals(4, chunks.get(1).offset());
        assertEquals(12, chunks.get(1).offsetEnd());
        assertEquals("She lived in London. The end.", chunks.get(1).text());
    }

    @Test
    void testLastWindowIsClipped() {
        List<TextChunk> chunks = sentenceChunker.slidingWindow(document, 2, 2);

        assertEquals(2, chunks.size());
        assertEquals(9, chunks.get(1).offset());
        assertEquals(12, chunks.get(1).offsetEnd());
    }

    @Test
    void testWindowLargerThanDocument() {
        List<TextChunk> chunks = sentenceChunker.slidingWindow(document, 10, 3);

        assertEquals(1, chunks.size());
        assertEquals(TEXT, chunks.get(0).text());
        assertEquals(2, chunks.get(0).entities().size());
    }

    @Test
    void testRejectInvalidWindow() {
        assertThrows(IllegalArgumentException.class, () -> sentenceChunker.slidingWindow(document, 0, 1));
        assertThrows(IllegalArgumentException.class, () -> sentenceChunker.slidingWindow(document, 2, 3));
        assertThrows(IllegalArgumentException.class, () -> sentenceChunker.slidingWindow(document, 2, 0));
    }

    @Test
    void testRequiresSegmentation() {
        IeDocument unsegmented = new IeDocument("raw", "a b");
        preprocessState.setResult(unsegmented, PreprocessStage.TOKENIZATION, List.of("a", "b"));

        assertThrows(IllegalStateException.class, () -> sentenceChunker.bySentence(unsegmented));
    }

    private static List<Integer> offsetsOf(String text, List<String> tokens) {
        List<Integer> offsets = new ArrayList<>();
        int cursor = 0;
        for (String token : tokens) {
            int found = text.indexOf(token, cursor);
            offsets.add(found);
            cursor = found + token.length();
        }
        return offsets;
    }

    @Test
    @DisplayName("分句后重新分词，边界过期")
    void testStaleSegmentationAfterRetokenization() {
        preprocessState.setResult(document, PreprocessStage.TOKENIZATION, List.of("Ada", "was", "born", "."));

        IllegalStateException exception = assertThrows(IllegalStateException.class,
            () -> sentenceChunker.bySentence(document));
        assertTrue(exception.getMessage().contains("tokens=4"));
    }
}
