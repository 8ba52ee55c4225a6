package com.migranet.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.migranet.core.classifier.DeploymentErrorKind;
import com.migranet.core.memory.PersistenceException;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.repair.DeploymentAttempt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class UnresolvedReportWriterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-05-01T10:15:30Z"), ZoneOffset.UTC);

    @TempDir
    Path tempDir;

    private UnresolvedReport report(String id) {
        return UnresolvedReport.builder(id)
                .object("GET_EMP", "HR", null, ObjectKind.PROCEDURE)
                .reason("Max repair attempts exceeded without success")
                .attempts(List.of(DeploymentAttempt.builder(1)
                        .rawError("Incorrect syntax near 'END'.")
                        .errorKind(DeploymentErrorKind.SYNTAX)
                        .signature("Procedure:syntax:incorrect syntax near ?.")
                        .build()))
                .finalError("Incorrect syntax near 'END'.")
                .finalAttemptedText("CREATE PROCEDURE [dbo].[GET_EMP] AS")
                .sourceText("x".repeat(UnresolvedReport.EXCERPT_CHARS + 500))
                .memoryContext(Map.of("last_signature", "Procedure:syntax:incorrect syntax near ?."))
                .build();
    }

    @Test
    void reportIdIsNameAndTimestamp() {
        UnresolvedReportWriter writer = new UnresolvedReportWriter(tempDir, FIXED);

        assertEquals("GET_EMP_20240501_101530", writer.allocateReportId("GET_EMP"));
    }

    @Test
    void unsafeCharactersAreReplaced() {
        UnresolvedReportWriter writer = new UnresolvedReportWriter(tempDir, FIXED);

        assertEquals("EMP_PKG_raise_20240501_101530", writer.allocateReportId("EMP/PKG raise"));
    }

    @Test
    void sameSecondCollisionsGetASuffix() throws Exception {
        UnresolvedReportWriter writer = new UnresolvedReportWriter(tempDir, FIXED);

        String first = writer.allocateReportId("GET_EMP");
        writer.write(report(first));
        String second = writer.allocateReportId("GET_EMP");

        assertEquals(first + "_2", second);
    }

    @Test
    void existingReportIsNeverOverwritten() throws Exception {
        UnresolvedReportWriter writer = new UnresolvedReportWriter(tempDir, FIXED);
        String id = writer.allocateReportId("GET_EMP");
        writer.write(report(id));

        assertThrows(PersistenceException.class, () -> writer.write(report(id)));
    }

    @Test
    void reportDocumentHasAllFields() throws Exception {
        UnresolvedReportWriter writer = new UnresolvedReportWriter(tempDir.resolve("nested/unresolved"), FIXED);
        String id = writer.allocateReportId("GET_EMP");

        Path file = writer.write(report(id));

        assertEquals(writer.pathFor(id), file);
        JsonNode json = new ObjectMapper().readTree(Files.readString(file));
        assertEquals(id, json.get("report_id").asText());
        assertEquals("GET_EMP", json.get("object_name").asText());
        assertEquals("PROCEDURE", json.get("object_type").asText());
        assertEquals(1, json.get("total_attempts").asInt());
        assertEquals("SYNTAX", json.get("attempts").get(0).get("error_kind").asText());
        assertEquals(UnresolvedReport.EXCERPT_CHARS, json.get("source_excerpt").asText().length());
        assertEquals(UnresolvedReport.RECOMMENDATIONS.size(), json.get("recommendations").size());
        assertTrue(json.get("memory_context").has("last_signature"));
        assertFalse(json.get("attempts").get(0).has("fix_applied"));
    }

    @Test
    void writeFailureIsReported() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");
        UnresolvedReportWriter writer = new UnresolvedReportWriter(blocker, FIXED);

        assertThrows(PersistenceException.class, () -> writer.write(report("X_1")));
    }
}
