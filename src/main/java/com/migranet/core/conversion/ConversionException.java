package com.migranet.core.conversion;

/**
 * A converter or translator could not produce target text.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
