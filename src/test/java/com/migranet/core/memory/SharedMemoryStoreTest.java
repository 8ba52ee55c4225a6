package com.migranet.core.memory;

import com.migranet.core.memory.ObjectDescription.ColumnDescription;
import com.migranet.core.memory.ObjectDescription.ConstraintDescription;
import com.migranet.core.model.ObjectKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SharedMemoryStoreTest {

    @TempDir
    Path tempDir;

    private MemoryStore populatedStore() {
        MemoryStore store = new MemoryStore();
        store.upsertSchema("EMPLOYEES", new ObjectDescription("dbo", "EMPLOYEES", ObjectKind.TABLE,
                List.of(new ColumnDescription("EMP_ID", "int", false, true),
                        new ColumnDescription("NAME", "varchar(100)", true, false)),
                List.of(new ConstraintDescription("PK_EMP", "PRIMARY KEY", List.of("EMP_ID")))));
        store.upsertIdentityColumns("EMPLOYEES", List.of("EMP_ID"));
        store.upsertTableMapping("EMPLOYEES", new TableMapping("EMPLOYEES", "dbo", "EMPLOYEES"));
        store.appendSolution(ErrorSolution.of("Table:identity-column:xyz", "SET IDENTITY_INSERT", SolutionSource.WEB_SEARCH));
        store.appendPattern(MigrationPattern.success(ObjectKind.TABLE, "EMPLOYEES", "Deployed on attempt 1"));
        store.appendPattern(MigrationPattern.failure(ObjectKind.PROCEDURE, "GET_EMP", "Unresolved"));
        store.markSchemaPresent("app");
        return store;
    }

    @Test
    void persistThenLoadRoundTrips() {
        SharedMemoryStore shared = new SharedMemoryStore(tempDir.resolve("memory.json"));
        MemoryStore original = populatedStore();

        assertTrue(shared.persist(original));
        MemoryStore loaded = shared.load();

        assertEquals(original, loaded);
        assertEquals(List.of("EMP_ID"), loaded.getIdentityColumns("employees"));
        assertEquals(List.of("EMP_ID"), loaded.getSchema("EMPLOYEES").getIdentityColumns());
        assertTrue(loaded.isSchemaPresent("APP"));
    }

    @Test
    void persistedDocumentHasExpectedSections() throws Exception {
        Path file = tempDir.resolve("memory.json");
        new SharedMemoryStore(file).persist(populatedStore());

        String json = Files.readString(file);
        for (String section : List.of("\"schemas\"", "\"identity_columns\"", "\"table_mappings\"",
                "\"error_solutions\"", "\"patterns\"", "\"target_schemas\"", "\"last_updated\"")) {
            assertTrue(json.contains(section), "missing section " + section);
        }
        assertTrue(json.contains("\"web-search\""));
    }

    @Test
    void persistLeavesNoTempFilesBehind() throws Exception {
        SharedMemoryStore shared = new SharedMemoryStore(tempDir.resolve("memory.json"));
        shared.persist(populatedStore());
        shared.persist(populatedStore());

        try (var files = Files.list(tempDir)) {
            assertEquals(List.of("memory.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void missingFileLoadsEmpty() {
        MemoryStore store = new SharedMemoryStore(tempDir.resolve("absent.json")).load();
        assertTrue(store.isEmpty());
    }

    @Test
    void malformedFileLoadsEmpty() throws Exception {
        Path file = tempDir.resolve("memory.json");
        Files.writeString(file, "{ \"patterns\": [ {\"kind\": ");

        MemoryStore store = new SharedMemoryStore(file).load();
        assertTrue(store.isEmpty());
    }

    @Test
    void wrongShapeDocumentLoadsEmpty() throws Exception {
        Path file = tempDir.resolve("memory.json");
        Files.writeString(file, "{ \"patterns\": \"not a list\", \"schemas\": 42 }");

        assertTrue(new SharedMemoryStore(file).load().isEmpty());
    }

    @Test
    void emptyAndNullDocumentsLoadEmpty() throws Exception {
        Path file = tempDir.resolve("memory.json");
        Files.writeString(file, "");
        assertTrue(new SharedMemoryStore(file).load().isEmpty());

        Files.writeString(file, "null");
        assertTrue(new SharedMemoryStore(file).load().isEmpty());
    }

    @Test
    void unknownSectionsAreIgnored() throws Exception {
        Path file = tempDir.resolve("memory.json");
        Files.writeString(file, "{ \"patterns\": [], \"legacy_section\": {\"a\": 1}, \"last_updated\": \"x\" }");

        MemoryStore store = new SharedMemoryStore(file).load();
        assertTrue(store.isEmpty());
    }

    @Test
    void persistenceFailureSwitchesToInMemoryOnly() throws Exception {
        // the parent "directory" is a regular file, so nothing can be written below it
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");
        SharedMemoryStore shared = new SharedMemoryStore(blocker.resolve("memory.json"));

        assertFalse(shared.persist(populatedStore()));
        assertTrue(shared.isInMemoryOnly());

        assertFalse(shared.persist(populatedStore()), "later flushes are skipped");
        assertTrue(shared.isInMemoryOnly());
    }
}
