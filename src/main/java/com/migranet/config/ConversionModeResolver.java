package com.migranet.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;

/**
 * Reads migranet.conversion.mode. Case and '-'/'_' are ignored; any other
 * value fails startup.
 */
@Component
public class ConversionModeResolver {

    private final ConversionMode mode;

    public ConversionModeResolver(
        @Value("${migranet.conversion.mode:PRIMARY_FIRST}") String mode
    ) {
        this.mode = parse(mode);
    }

    static ConversionMode parse(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return ConversionMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("migranet.conversion.mode must be one of "
                    + Arrays.toString(ConversionMode.values()) + ", got '" + raw + "'", e);
        }
    }

    public boolean isPrimaryFirst() {
        return mode == ConversionMode.PRIMARY_FIRST;
    }

    public boolean isFallbackOnly() {
        return mode == ConversionMode.FALLBACK_ONLY;
    }

    public ConversionMode getMode() {
        return mode;
    }
}
