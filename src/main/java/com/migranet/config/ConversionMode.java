package com.migranet.config;

/**
 * PRIMARY_FIRST: rule-based converter first, fallback translator only when its
 * diagnostics are not acceptable.
 * FALLBACK_ONLY: skip the primary converter entirely.
 */
public enum ConversionMode {
    PRIMARY_FIRST,
    FALLBACK_ONLY
}
