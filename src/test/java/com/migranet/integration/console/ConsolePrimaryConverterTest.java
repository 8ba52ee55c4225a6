package com.migranet.integration.console;

import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.PrimaryConverter.PrimaryOutput;
import com.migranet.core.model.ObjectKind;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ConsolePrimaryConverterTest {

    @TempDir
    Path tempDir;

    @Test
    void blankCommandMeansUnavailable() {
        ConsolePrimaryConverter converter = new ConsolePrimaryConverter("  ", Duration.ofSeconds(5));

        assertFalse(converter.isAvailable());
        assertThrows(ConversionException.class, () -> converter.convert("SELECT 1 FROM DUAL", ObjectKind.PROCEDURE));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void runsToolAndCollectsOutput() throws Exception {
        Path script = tempDir.resolve("convert.sh");
        Files.writeString(script,
                "cp \"$1\" \"$2\"\n"
                + "echo \"WARNING: kind $3\"\n"
                + "exit 0\n");
        ConsolePrimaryConverter converter = new ConsolePrimaryConverter(
                "sh " + script + " {input} {output} {kind}", Duration.ofSeconds(20));

        PrimaryOutput output = converter.convert("CREATE TABLE T (ID INT)", ObjectKind.TABLE);

        assertEquals("CREATE TABLE T (ID INT)", output.getConvertedText());
        assertTrue(output.getDiagnostics().contains("WARNING: kind TABLE"));
        assertEquals(0, output.getExitCode());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitIsReportedNotThrown() throws Exception {
        Path script = tempDir.resolve("fail.sh");
        Files.writeString(script, "echo \"ERROR: cannot parse\"\nexit 3\n");
        ConsolePrimaryConverter converter = new ConsolePrimaryConverter(
                "sh " + script + " {input} {output}", Duration.ofSeconds(20));

        PrimaryOutput output = converter.convert("garbage", ObjectKind.FUNCTION);

        assertEquals(3, output.getExitCode());
        assertEquals("", output.getConvertedText());
        assertTrue(output.getDiagnostics().contains("ERROR: cannot parse"));
    }
}
