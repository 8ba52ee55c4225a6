package com.migranet.core.conversion;

import java.util.Objects;

/**
 * Output of one conversion attempt. Immutable.
 */
public final class ConversionResult {

    private final ConversionTool tool;
    private final String         text;
    private final int            errorCount;
    private final int            warningCount;

    public ConversionResult(ConversionTool tool, String text, int errorCount, int warningCount) {
        this.tool         = Objects.requireNonNull(tool, "tool");
        this.text         = text != null ? text : "";
        this.errorCount   = Math.max(0, errorCount);
        this.warningCount = Math.max(0, warningCount);
    }

    public static ConversionResult fallback(String text) {
        return new ConversionResult(ConversionTool.FALLBACK, text, 0, 0);
    }

    public ConversionTool getTool()         { return tool; }
    public String         getText()         { return text; }
    public int            getErrorCount()   { return errorCount; }
    public int            getWarningCount() { return warningCount; }

    public boolean hasText() {
        return !text.isBlank();
    }

    /** Same text, different tool label (primary text kept after fallback failure). */
    public ConversionResult withText(String newText) {
        return new ConversionResult(tool, newText, errorCount, warningCount);
    }

    @Override
    public String toString() {
        return "ConversionResult{" + tool + ", errors=" + errorCount + ", warnings=" + warningCount
                + ", chars=" + text.length() + "}";
    }
}
