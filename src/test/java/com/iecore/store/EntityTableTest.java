package com.iecore.store;

import com.iecore.document.Entity;
import com.iecore.document.EntityKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EntityTableTest {
    @TempDir
    Path tempDir;

    @Test
    void testInsertAndFind() {
        try (EntityTable entityTable = new EntityTable(tempDir.resolve("entities.db"))) {
            Entity ada = new Entity("ada", "Ada Lovelace", EntityKind.PERSON);
            entityTable.insert(ada);

            assertEquals(Optional.of(ada), entityTable.findByKey("ada"));
            assertEquals(Optional.empty(), entityTable.findByKey("babbage"));
            assertEquals(1, entityTable.count());
        }
    }

    @Test
    void testInsertRejectsDuplicateKey() {
        try (EntityTable entityTable = new EntityTable(tempDir.resolve("entities.db"))) {
            entityTable.insert(new Entity("acme", "ACME", EntityKind.ORGANIZATION));

            assertThrows(IllegalStateException.class,
                () -> entityTable.insert(new Entity("acme", "Acme Corp", EntityKind.ORGANIZATION)));
            assertEquals("ACME", entityTable.findByKey("acme").orElseThrow().canonicalForm());
        }
    }

    @Test
    void testUpsertReplacesExisting() {
        try (EntityTable entityTable = new EntityTable(tempDir.resolve("entities.db"))) {
            entityTable.upsert(new Entity("paris", "Paris", EntityKind.LOCATION));
            entityTable.upsert(new Entity("paris", "Paris, France", EntityKind.LOCATION));

            assertEquals(1, entityTable.count());
            assertEquals("Paris, France", entityTable.findByKey("paris").orElseThrow().canonicalForm());
        }
    }

    @Test
    void testUpsertAllWritesBatch() {
        try (EntityTable entityTable = new EntityTable(tempDir.resolve("entities.db"))) {
            entityTable.upsert(new Entity("paris", "Paris", EntityKind.LOCATION));

            entityTable.upsertAll(List.of(
                new Entity("paris", "Paris, France", EntityKind.LOCATION),
                new Entity("acme", "ACME", EntityKind.ORGANIZATION)));

            assertEquals(2, entityTable.count());
            assertEquals("Paris, France", entityTable.findByKey("paris").orElseThrow().canonicalForm());
            assertEquals(Optional.of(new Entity("acme", "ACME", EntityKind.ORGANIZATION)), entityTable.findByKey("acme"));
        }
    }
}
