package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Where a stored fix originally came from. */
public enum SolutionSource {

    MEMORY("memory"),
    WEB_SEARCH("web-search"),
    TRANSLATOR("translator");

    private final String code;

    SolutionSource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() { return code; }

    @JsonCreator
    public static SolutionSource fromCode(String code) {
        for (SolutionSource s : values()) {
            if (s.code.equalsIgnoreCase(code) || s.name().equalsIgnoreCase(code)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown solution source: " + code.toLowerCase(Locale.ROOT));
    }
}
