package com.migranet.core.conversion;

import com.migranet.config.MigrationSettings;

import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Points converted text at the target schema.
 *
 * 1. SCHEMA.OBJECT / [SCHEMA].[OBJECT] / "SCHEMA"."OBJECT" where SCHEMA is the
 *    object's source schema or a stock Oracle schema becomes [target].[OBJECT].
 *    Other qualifiers (table aliases, foreign schemas) are left alone.
 * 2. Unqualified CREATE TABLE / PROCEDURE / FUNCTION / TRIGGER / VIEW names are
 *    qualified with the target schema.
 */
@Component
public class SchemaReferenceRewriter {

    private static final List<String> STOCK_SOURCE_SCHEMAS =
            List.of("APP", "HR", "SCOTT", "SYSTEM", "SYS", "PUBLIC", "APEX", "ORACLE");

    private static final Pattern QUALIFIED = Pattern.compile(
            "(?<![\\w\\]\\.\"])(?:\\[([A-Za-z_][\\w$#]*)\\]|\"([A-Za-z_][\\w$#]*)\"|([A-Za-z_][\\w$#]*))"
            + "\\.(?:\\[([A-Za-z_][\\w$#]*)\\]|\"([A-Za-z_][\\w$#]*)\"|([A-Za-z_][\\w$#]*))");

    private static final Pattern UNQUALIFIED_CREATE = Pattern.compile(
            "\\b(CREATE(?:\\s+OR\\s+ALTER)?\\s+(?:TABLE|PROCEDURE|PROC|FUNCTION|TRIGGER|VIEW))\\s+"
            + "(?:\\[([A-Za-z_][\\w$#]*)\\]|([A-Za-z_][\\w$#]*))(?=\\s|\\(|$)(?!\\s*\\.)",
            Pattern.CASE_INSENSITIVE);

    private final String targetSchema;

    public SchemaReferenceRewriter(MigrationSettings settings) {
        this.targetSchema = settings.getTargetSchema();
    }

    public String rewrite(String sql, String sourceSchema) {
        if (sql == null || sql.isEmpty()) {
            return sql;
        }
        Set<String> replaceable = new LinkedHashSet<>(STOCK_SOURCE_SCHEMAS);
        if (sourceSchema != null && !sourceSchema.isBlank()) {
            replaceable.add(sourceSchema.trim().toUpperCase(Locale.ROOT));
        }

        String result = rewriteQualified(sql, replaceable);
        return qualifyCreateStatements(result);
    }

    private String rewriteQualified(String sql, Set<String> replaceable) {
        Matcher m = QUALIFIED.matcher(sql);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String schema = firstNonNull(m.group(1), m.group(2), m.group(3));
            String object = firstNonNull(m.group(4), m.group(5), m.group(6));
            String replacement = replaceable.contains(schema.toUpperCase(Locale.ROOT))
                    ? "[" + targetSchema + "].[" + object + "]"
                    : m.group();
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String qualifyCreateStatements(String sql) {
        Matcher m = UNQUALIFIED_CREATE.matcher(sql);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String name = m.group(2) != null ? m.group(2) : m.group(3);
            m.appendReplacement(out, Matcher.quoteReplacement(
                    m.group(1) + " [" + targetSchema + "].[" + name + "]"));
        }
        m.appendTail(out);
        return out.toString();
    }

    private static String firstNonNull(String... values) {
        for (String v : values) {
            if (v != null) return v;
        }
        return null;
    }
}
