package com.migranet.testing;

import com.migranet.core.conversion.ConversionException;
import com.migranet.core.conversion.PrimaryConverter;
import com.migranet.core.model.ObjectKind;

/**
 * Primary converter returning fixed text and diagnostics.
 */
public class FakePrimaryConverter implements PrimaryConverter {

    private final String  text;
    private final String  diagnostics;
    private final boolean failing;
    private int calls;

    private FakePrimaryConverter(String text, String diagnostics, boolean failing) {
        this.text        = text;
        this.diagnostics = diagnostics;
        this.failing     = failing;
    }

    public static FakePrimaryConverter clean(String text) {
        return new FakePrimaryConverter(text, "", false);
    }

    public static FakePrimaryConverter withWarnings(String text, int warnings) {
        StringBuilder sb = new StringBuilder();
        for (int i = 1; i <= warnings; i++) {
            sb.append("WARNING: issue ").append(i).append('\n');
        }
        return new FakePrimaryConverter(text, sb.toString(), false);
    }

    public static FakePrimaryConverter failing() {
        return new FakePrimaryConverter("", "", true);
    }

    @Override
    public synchronized PrimaryOutput convert(String sourceText, ObjectKind kind) throws ConversionException {
        calls++;
        if (failing) {
            throw new ConversionException("converter crashed");
        }
        return new PrimaryOutput(text, diagnostics, 0);
    }

    public synchronized int getCallCount() {
        return calls;
    }
}
