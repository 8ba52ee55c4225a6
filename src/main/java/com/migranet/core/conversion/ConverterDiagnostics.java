package com.migranet.core.conversion;

import java.util.List;
import java.util.Locale;

/**
 * Counts errors and warnings in primary converter output.
 *
 * - lines with "ERROR:" / "Error:" are errors
 * - lines with "WARNING:" / "Warning:" are warnings, unless they carry a critical
 *   phrase, in which case they count as errors
 * - blank or near-empty converted text is one more error
 * - a nonzero exit code is one more error
 */
public final class ConverterDiagnostics {

    static final int MIN_MEANINGFUL_CHARS = 10;

    private static final List<String> CRITICAL_PHRASES = List.of(
            "not supported",
            "cannot convert",
            "manual intervention",
            "incomplete conversion"
    );

    private final int errorCount;
    private final int warningCount;

    private ConverterDiagnostics(int errorCount, int warningCount) {
        this.errorCount   = errorCount;
        this.warningCount = warningCount;
    }

    public static ConverterDiagnostics parse(PrimaryConverter.PrimaryOutput output) {
        int errors   = 0;
        int warnings = 0;

        for (String line : output.getDiagnostics().split("\\R")) {
            if (line.contains("ERROR:") || line.contains("Error:")) {
                errors++;
            } else if (line.contains("WARNING:") || line.contains("Warning:")) {
                if (isCritical(line)) {
                    errors++;
                } else {
                    warnings++;
                }
            }
        }

        if (output.getConvertedText().replaceAll("\\s", "").length() < MIN_MEANINGFUL_CHARS) {
            errors++;
        }
        if (output.getExitCode() != 0) {
            errors++;
        }
        return new ConverterDiagnostics(errors, warnings);
    }

    private static boolean isCritical(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (String phrase : CRITICAL_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }

    public int getErrorCount()   { return errorCount; }
    public int getWarningCount() { return warningCount; }
}
