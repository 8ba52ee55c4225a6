package com.migranet.core.conversion;

import com.migranet.core.model.ObjectKind;

/**
 * Deterministic rule-based source → target converter.
 *
 * Implementations return the raw tool output; ConversionRouter derives the
 * error/warning counts from it through ConverterDiagnostics.
 */
public interface PrimaryConverter {

    PrimaryOutput convert(String sourceText, ObjectKind kind) throws ConversionException;

    default boolean isAvailable() {
        return true;
    }

    /**
     * @param convertedText translated text (may be empty)
     * @param diagnostics   tool log/console output holding ERROR:/WARNING: lines
     * @param exitCode      process exit code, 0 when not applicable
     */
    final class PrimaryOutput {
        private final String convertedText;
        private final String diagnostics;
        private final int    exitCode;

        public PrimaryOutput(String convertedText, String diagnostics, int exitCode) {
            this.convertedText = convertedText != null ? convertedText : "";
            this.diagnostics   = diagnostics != null ? diagnostics : "";
            this.exitCode      = exitCode;
        }

        public String getConvertedText() { return convertedText; }
        public String getDiagnostics()   { return diagnostics; }
        public int    getExitCode()      { return exitCode; }
    }
}
