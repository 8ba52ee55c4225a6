package com.migranet.core.conversion;

import com.migranet.core.model.ObjectKind;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RowDataGuardTest {

    @Test
    void rowDataSectionIsRejected() {
        TranslationRequest request = TranslationRequest.builder("EMP", ObjectKind.PROCEDURE)
                .section(TranslationRequest.SectionType.ROW_DATA, "Sample rows", "1,Alice")
                .build();

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> RowDataGuard.requireNoRowDataSection(request));
        assertTrue(e.getMessage().contains("Sample rows"));
    }

    @Test
    void literalInsertsInTablePayloadAreFound() {
        TranslationRequest request = TranslationRequest.builder("EMP", ObjectKind.TABLE)
                .section(TranslationRequest.SectionType.DDL, "Source", "CREATE TABLE EMP (ID NUMBER)")
                .section(TranslationRequest.SectionType.DDL, "Failing target text",
                        "CREATE TABLE EMP (ID INT);\ninsert into EMP (ID)\n  values (42);")
                .build();

        assertDoesNotThrow(() -> RowDataGuard.requireNoRowDataSection(request));
        assertEquals("Failing target text",
                RowDataGuard.findRowValues(request).map(TranslationRequest.Section::getTitle).orElse(null));
    }

    @Test
    void proceduresMayContainInsertStatements() {
        TranslationRequest request = TranslationRequest.builder("ADD_EMP", ObjectKind.PROCEDURE)
                .section(TranslationRequest.SectionType.CODE, "Source",
                        "CREATE PROCEDURE ADD_EMP(p_id NUMBER) IS BEGIN INSERT INTO EMP (ID) VALUES (p_id); END;")
                .build();

        assertTrue(RowDataGuard.findRowValues(request).isEmpty());
    }

    @Test
    void plainDdlPasses() {
        TranslationRequest request = TranslationRequest.builder("EMP", ObjectKind.TABLE)
                .section(TranslationRequest.SectionType.DDL, "Source", "CREATE TABLE EMP (ID NUMBER)")
                .section(TranslationRequest.SectionType.METADATA, "Identity", "ID")
                .build();

        assertDoesNotThrow(() -> RowDataGuard.requireNoRowDataSection(request));
        assertTrue(RowDataGuard.findRowValues(request).isEmpty());
    }
}
