package com.iecore.cli;

import com.iecore.document.EntityKind;
import com.iecore.document.IeDocument;
import com.iecore.preprocess.CardinalityException;
import com.iecore.preprocess.PreprocessStage;
import com.iecore.preprocess.PreprocessState;
import com.iecore.store.DocumentTable;
import com.iecore.store.EntityTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DocumentImporterTest {
    @TempDir
    Path tempDir;

    @Test
    void testImportAppliesStagesAndStoresEntities() {
        DocumentImport source = new DocumentImport(
            "news-1", "Visit", null, "Ada visited Paris.", Map.of("lang", "en"),
            List.of("Ada", "visited", "Paris", "."),
            List.of(0, 4, 12, 17),
            List.of(0, 4),
            null,
            List.of(
                new DocumentImport.Mention("paris", "Paris", "location", 2, null),
                new DocumentImport.Mention("ada", "Ada Lovelace", "person", 0, "Ada")
            )
        );
        PreprocessState preprocessState = new PreprocessState();

        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("ie.db"));
             EntityTable entityTable = new EntityTable(tempDir.resolve("ie.db"))) {
            new DocumentImporter(preprocessState, documentTable, entityTable).importDocument(source);

            IeDocument stored = documentTable.findByIdentifier("news-1").orElseThrow();
            assertEquals(List.of("ada", "paris"), stored.getEntities().stream().map(o -> o.entityKey()).toList());
            assertTrue(preprocessState.wasDone(stored, PreprocessStage.TOKENIZATION));
            assertTrue(preprocessState.wasDone(stored, PreprocessStage.SEGMENTATION));
            assertTrue(preprocessState.wasDone(stored, PreprocessStage.NERC));
            assertFalse(preprocessState.wasDone(stored, PreprocessStage.TAGGING));
            assertEquals("en", stored.getMetadata().get("lang"));
            assertEquals(EntityKind.PERSON, entityTable.findByKey("ada").orElseThrow().kind());
        }
    }

    @Test
    void testImportRejectsInvalidStageResult() {
        DocumentImport source = new DocumentImport(
            "bad", null, null, "a b", null,
            List.of("a", "b"), null, null, List.of("X"), null);

        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("ie.db"));
             EntityTable entityTable = new EntityTable(tempDir.resolve("ie.db"))) {
            DocumentImporter importer = new DocumentImporter(new PreprocessState(), documentTable, entityTable);

            assertThrows(CardinalityException.class, () -> importer.importDocument(source));
            assertEquals(0, documentTable.count());
        }
    }

    @Test
    void testInvalidMentionLeavesEntityTableUntouched() {
        DocumentImport source = new DocumentImport(
            "mixed", null, null, "ok bad", null,
            List.of("ok", "bad"), null, null, null,
            List.of(
                new DocumentImport.Mention("ok", "Ok", "person", 0, null),
                new DocumentImport.Mention("bad", "Bad", "event", 1, null)
            ));

        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("ie.db"));
             EntityTable entityTable = new EntityTable(tempDir.resolve("ie.db"))) {
            DocumentImporter importer = new DocumentImporter(new PreprocessState(), documentTable, entityTable);

            assertThrows(IllegalArgumentException.class, () -> importer.importDocument(source));
            assertEquals(0, documentTable.count());
            assertEquals(0, entityTable.count());
        }
    }

    @Test
    void testNegativeMentionOffsetLeavesEntityTableUntouched() {
        DocumentImport source = new DocumentImport(
            "negative", null, null, "a b", null,
            List.of("a", "b"), null, null, null,
            List.of(
                new DocumentImport.Mention("a", "A", "location", 0, null),
                new DocumentImport.Mention("b", "B", "location", -1, null)
            ));

        try (DocumentTable documentTable = new DocumentTable(tempDir.resolve("ie.db"));
             EntityTable entityTable = new EntityTable(tempDir.resolve("ie.db"))) {
            DocumentImporter importer = new DocumentImporter(new PreprocessState(), documentTable, entityTable);

            assertThrows(IllegalArgumentException.class, () -> importer.importDocument(source));
            assertEquals(0, entityTable.count());
        }
    }
}
