package com.migranet.core.conversion;

/**
 * Generative, context-aware translator. Used when the primary converter's output
 * is not acceptable, and by the repair loop to patch failing target text.
 */
public interface FallbackTranslator {

    /** @return translated or patched target text, never blank */
    String translate(TranslationRequest request) throws ConversionException;
}
