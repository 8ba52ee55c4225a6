package com.migranet.integration.sqlserver;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a T-SQL script into batches on GO separator lines, the way sqlcmd does.
 * JDBC cannot execute GO itself.
 */
public final class SqlBatchSplitter {

    private static final Pattern GO_LINE   = Pattern.compile("^\\s*GO\\s*;?\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern FENCE_LINE = Pattern.compile("^\\s*```.*$");

    private SqlBatchSplitter() {}

    public static List<String> split(String script) {
        List<String> batches = new ArrayList<>();
        if (script == null) {
            return batches;
        }
        StringBuilder current = new StringBuilder();
        for (String line : script.split("\\R", -1)) {
            if (FENCE_LINE.matcher(line).matches()) {
                continue;
            }
            if (GO_LINE.matcher(line).matches()) {
                addIfNotBlank(batches, current);
                current.setLength(0);
            } else {
                current.append(line).append('\n');
            }
        }
        addIfNotBlank(batches, current);
        return batches;
    }

    private static void addIfNotBlank(List<String> batches, StringBuilder batch) {
        String text = batch.toString().strip();
        if (!text.isEmpty()) {
            batches.add(text);
        }
    }
}
