package com.migranet.core.conversion;

public enum ConversionTool {
    PRIMARY,
    FALLBACK
}
