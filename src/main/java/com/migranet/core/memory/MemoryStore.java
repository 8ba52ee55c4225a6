package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.model.ObjectKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * MemoryStore: the cross-object learning state shared by every migration in a run.
 *
 * Sections (JSON names in brackets):
 *   schemas          [schemas]          object name → ObjectDescription
 *   identity columns [identity_columns] table name  → identity column names
 *   table mappings   [table_mappings]   source name → TableMapping
 *   error solutions  [error_solutions]  signature   → fixes, oldest first on disk
 *   patterns         [patterns]         append-only outcome log
 *   target schemas   [target_schemas]   target schemas known to exist
 *
 * Object-name keys are case-insensitive and stored upper-case. Mutated only by the
 * orchestrating thread; SharedMemoryStore owns load/persist.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MemoryStore {

    private final Map<String, ObjectDescription>    schemas;
    private final Map<String, List<String>>         identityColumns;
    private final Map<String, TableMapping>         tableMappings;
    private final Map<String, List<ErrorSolution>>  errorSolutions;
    private final List<MigrationPattern>            patterns;
    private final Set<String>                       targetSchemas;

    public MemoryStore() {
        this(null, null, null, null, null, null);
    }

    @JsonCreator
    public MemoryStore(
            @JsonProperty("schemas")          Map<String, ObjectDescription> schemas,
            @JsonProperty("identity_columns") Map<String, List<String>> identityColumns,
            @JsonProperty("table_mappings")   Map<String, TableMapping> tableMappings,
            @JsonProperty("error_solutions")  Map<String, List<ErrorSolution>> errorSolutions,
            @JsonProperty("patterns")         List<MigrationPattern> patterns,
            @JsonProperty("target_schemas")   List<String> targetSchemas
    ) {
        this.schemas         = new LinkedHashMap<>();
        this.identityColumns = new LinkedHashMap<>();
        this.tableMappings   = new LinkedHashMap<>();
        this.errorSolutions  = new LinkedHashMap<>();
        this.patterns        = new ArrayList<>();
        this.targetSchemas   = new TreeSet<>();

        if (schemas != null) {
            schemas.forEach((k, v) -> { if (v != null) this.schemas.put(key(k), v); });
        }
        if (identityColumns != null) {
            identityColumns.forEach((k, v) -> { if (v != null) this.identityColumns.put(key(k), List.copyOf(v)); });
        }
        if (tableMappings != null) {
            tableMappings.forEach((k, v) -> { if (v != null) this.tableMappings.put(key(k), v); });
        }
        if (errorSolutions != null) {
            errorSolutions.forEach((k, v) -> {
                if (k != null && v != null) this.errorSolutions.put(k, new ArrayList<>(v));
            });
        }
        if (patterns != null) {
            patterns.stream().filter(Objects::nonNull).forEach(this.patterns::add);
        }
        if (targetSchemas != null) {
            targetSchemas.stream().filter(Objects::nonNull).map(MemoryStore::key).forEach(this.targetSchemas::add);
        }
    }

    private static String key(String objectName) {
        return Objects.requireNonNull(objectName, "object name").trim().toUpperCase(Locale.ROOT);
    }

    // =========================================================================
    // Error solutions
    // =========================================================================

    /** Up to {@code limit} solutions for the signature, most recent first. */
    public synchronized List<ErrorSolution> getSolutions(String signature, int limit) {
        List<ErrorSolution> stored = errorSolutions.get(signature);
        if (stored == null || stored.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<ErrorSolution> result = new ArrayList<>(Math.min(limit, stored.size()));
        for (int i = stored.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(stored.get(i));
        }
        return Collections.unmodifiableList(result);
    }

    public synchronized int countSolutions(String signature) {
        List<ErrorSolution> stored = errorSolutions.get(signature);
        return stored == null ? 0 : stored.size();
    }

    /** Older entries for the same signature are kept for audit. */
    public synchronized void appendSolution(ErrorSolution solution) {
        errorSolutions.computeIfAbsent(solution.getSignature(), s -> new ArrayList<>()).add(solution);
    }

    // =========================================================================
    // Patterns
    // =========================================================================

    public synchronized void appendPattern(MigrationPattern pattern) {
        patterns.add(Objects.requireNonNull(pattern, "pattern"));
    }

    /** Most recent patterns of the given kind and outcome, newest first. */
    public synchronized List<MigrationPattern> recentPatterns(ObjectKind kind,
                                                              MigrationPattern.Outcome outcome,
                                                              int limit) {
        List<MigrationPattern> result = new ArrayList<>();
        for (int i = patterns.size() - 1; i >= 0 && result.size() < limit; i--) {
            MigrationPattern p = patterns.get(i);
            if (p.getKind() == kind && (outcome == null || p.getOutcome() == outcome)) {
                result.add(p);
            }
        }
        return Collections.unmodifiableList(result);
    }

    // =========================================================================
    // Object metadata
    // =========================================================================

    public synchronized void upsertSchema(String objectName, ObjectDescription description) {
        schemas.put(key(objectName), Objects.requireNonNull(description, "description"));
    }

    public synchronized ObjectDescription getSchema(String objectName) {
        return schemas.get(key(objectName));
    }

    public synchronized void upsertIdentityColumns(String tableName, List<String> columns) {
        identityColumns.put(key(tableName), List.copyOf(columns));
    }

    public synchronized List<String> getIdentityColumns(String tableName) {
        return identityColumns.getOrDefault(key(tableName), List.of());
    }

    public synchronized void upsertTableMapping(String sourceName, TableMapping mapping) {
        tableMappings.put(key(sourceName), Objects.requireNonNull(mapping, "mapping"));
    }

    public synchronized TableMapping getTableMapping(String sourceName) {
        return tableMappings.get(key(sourceName));
    }

    // =========================================================================
    // Target schemas
    // =========================================================================

    public synchronized void markSchemaPresent(String schemaName) {
        targetSchemas.add(key(schemaName));
    }

    public synchronized boolean isSchemaPresent(String schemaName) {
        return targetSchemas.contains(key(schemaName));
    }

    // =========================================================================
    // Serialized views
    // =========================================================================

    @JsonProperty("schemas")
    public synchronized Map<String, ObjectDescription> getSchemas() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(schemas));
    }

    @JsonProperty("identity_columns")
    public synchronized Map<String, List<String>> getIdentityColumnsBySection() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(identityColumns));
    }

    @JsonProperty("table_mappings")
    public synchronized Map<String, TableMapping> getTableMappings() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tableMappings));
    }

    @JsonProperty("error_solutions")
    public synchronized Map<String, List<ErrorSolution>> getErrorSolutions() {
        return errorSolutions.entrySet().stream().collect(Collectors.toMap(
                Map.Entry::getKey,
                e -> List.copyOf(e.getValue()),
                (a, b) -> a,
                LinkedHashMap::new));
    }

    @JsonProperty("patterns")
    public synchronized List<MigrationPattern> getPatterns() {
        return List.copyOf(patterns);
    }

    @JsonProperty("target_schemas")
    public synchronized List<String> getTargetSchemas() {
        return List.copyOf(targetSchemas);
    }

    @JsonIgnore
    public synchronized boolean isEmpty() {
        return schemas.isEmpty() && identityColumns.isEmpty() && tableMappings.isEmpty()
                && errorSolutions.isEmpty() && patterns.isEmpty() && targetSchemas.isEmpty();
    }

    /** Section sizes, for logs and the REST memory endpoint. */
    public synchronized Map<String, Integer> statistics() {
        int solutionCount = errorSolutions.values().stream().mapToInt(List::size).sum();
        long successes = patterns.stream()
                .filter(p -> p.getOutcome() == MigrationPattern.Outcome.SUCCESS)
                .count();

        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("schemas",          schemas.size());
        stats.put("identity_columns", identityColumns.size());
        stats.put("table_mappings",   tableMappings.size());
        stats.put("error_signatures", errorSolutions.size());
        stats.put("error_solutions",  solutionCount);
        stats.put("patterns",         patterns.size());
        stats.put("success_patterns", (int) successes);
        stats.put("failure_patterns", patterns.size() - (int) successes);
        stats.put("target_schemas",   targetSchemas.size());
        return stats;
    }

    @Override
    public synchronized boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryStore)) return false;
        MemoryStore that = (MemoryStore) o;
        return schemas.equals(that.getSchemas())
                && identityColumns.equals(that.getIdentityColumnsBySection())
                && tableMappings.equals(that.getTableMappings())
                && getErrorSolutions().equals(that.getErrorSolutions())
                && patterns.equals(that.getPatterns())
                && getTargetSchemas().equals(that.getTargetSchemas());
    }

    @Override
    public synchronized int hashCode() {
        return Objects.hash(schemas, identityColumns, tableMappings, errorSolutions, patterns, targetSchemas);
    }

    @Override
    public String toString() {
        return "MemoryStore" + statistics();
    }
}
