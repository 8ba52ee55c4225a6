package com.migranet.core.conversion;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConverterDiagnosticsTest {

    private static final String TEXT = "CREATE TABLE [dbo].[T] (ID INT);";

    @Test
    void countsErrorAndWarningLines() {
        String log = "Info: started\n"
                + "WARNING: ROWNUM replaced by TOP\n"
                + "Warning: implicit cast\n"
                + "ERROR: unsupported hint\n"
                + "done";

        ConverterDiagnostics d = ConverterDiagnostics.parse(new PrimaryConverter.PrimaryOutput(TEXT, log, 0));

        assertEquals(1, d.getErrorCount());
        assertEquals(2, d.getWarningCount());
    }

    @Test
    void criticalWarningsCountAsErrors() {
        String log = "WARNING: CONNECT BY is not supported\n"
                + "WARNING: manual intervention required for cursor\n"
                + "WARNING: harmless";

        ConverterDiagnostics d = ConverterDiagnostics.parse(new PrimaryConverter.PrimaryOutput(TEXT, log, 0));

        assertEquals(2, d.getErrorCount());
        assertEquals(1, d.getWarningCount());
    }

    @Test
    void nearEmptyOutputIsAnError() {
        ConverterDiagnostics d = ConverterDiagnostics.parse(new PrimaryConverter.PrimaryOutput("  GO \n", "", 0));

        assertEquals(1, d.getErrorCount());
    }

    @Test
    void nonZeroExitCodeIsAnError() {
        ConverterDiagnostics d = ConverterDiagnostics.parse(new PrimaryConverter.PrimaryOutput(TEXT, "", 2));

        assertEquals(1, d.getErrorCount());
        assertEquals(0, d.getWarningCount());
    }

    @Test
    void cleanRunHasNothing() {
        ConverterDiagnostics d = ConverterDiagnostics.parse(new PrimaryConverter.PrimaryOutput(TEXT, null, 0));

        assertEquals(0, d.getErrorCount());
        assertEquals(0, d.getWarningCount());
    }
}
