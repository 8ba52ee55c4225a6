package com.migranet.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.model.ObjectKind;
import com.migranet.core.usage.ModelUsage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Batch outcome: per-kind migrated/failed counts, failed objects → report id,
 * skipped count, cancellation flag, translator usage.
 *
 * Failed objects are keyed by kind and qualified name ("Procedure HR.GET_EMP").
 */
public final class MigrationSummary {

    private final Map<ObjectKind, Integer>    migrated = new EnumMap<>(ObjectKind.class);
    private final Map<ObjectKind, Integer>    failed   = new EnumMap<>(ObjectKind.class);
    private final Map<String, String>         failedReports = new LinkedHashMap<>();
    private final List<ObjectMigrationResult> results  = new ArrayList<>();
    private List<ModelUsage> llmUsage = List.of();
    private int     skipped;
    private boolean cancelled;

    void record(ObjectMigrationResult result) {
        results.add(result);
        if (result.isDeployed()) {
            migrated.merge(result.getKind(), 1, Integer::sum);
        } else {
            failed.merge(result.getKind(), 1, Integer::sum);
            // report id can be null when the report write itself failed
            failedReports.put(result.getSummaryKey(), result.getReportId());
        }
    }

    void addSkipped(int count) {
        this.skipped += count;
    }

    void markCancelled() {
        this.cancelled = true;
    }

    void setLlmUsage(List<ModelUsage> usage) {
        this.llmUsage = List.copyOf(usage);
    }

    @JsonProperty("migrated")
    public Map<ObjectKind, Integer> getMigrated() { return Collections.unmodifiableMap(migrated); }

    @JsonProperty("failed")
    public Map<ObjectKind, Integer> getFailed() { return Collections.unmodifiableMap(failed); }

    @JsonProperty("failed_objects")
    public Map<String, String> getFailedReports() { return Collections.unmodifiableMap(failedReports); }

    @JsonProperty("results")
    public List<ObjectMigrationResult> getResults() { return Collections.unmodifiableList(results); }

    @JsonProperty("skipped")
    public int getSkipped() { return skipped; }

    @JsonProperty("cancelled")
    public boolean isCancelled() { return cancelled; }

    @JsonProperty("llm_usage")
    public List<ModelUsage> getLlmUsage() { return llmUsage; }

    @JsonProperty("llm_cost")
    public double getTotalLlmCost() {
        return llmUsage.stream().mapToDouble(ModelUsage::cost).sum();
    }

    public int getMigratedCount(ObjectKind kind) {
        return migrated.getOrDefault(kind, 0);
    }

    public int getFailedCount(ObjectKind kind) {
        return failed.getOrDefault(kind, 0);
    }

    public int getTotalMigrated() {
        return migrated.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotalFailed() {
        return failed.values().stream().mapToInt(Integer::intValue).sum();
    }

    /** Plain multi-line summary for the log. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Migration summary");
        if (cancelled) sb.append(" (CANCELLED)");
        sb.append("\n");
        for (ObjectKind kind : ObjectKind.values()) {
            int ok  = getMigratedCount(kind);
            int bad = getFailedCount(kind);
            if (ok + bad > 0) {
                sb.append(String.format("  %-14s migrated=%d failed=%d%n", kind.getLabel(), ok, bad));
            }
        }
        if (skipped > 0) {
            sb.append("  skipped=").append(skipped).append("\n");
        }
        failedReports.forEach((name, report) ->
                sb.append("  FAILED ").append(name).append(" → ").append(report != null ? report : "(no report)").append("\n"));
        for (ModelUsage usage : llmUsage) {
            sb.append(String.format("  LLM %s: %d request(s), %d in tok, %d out tok, $%.4f%n",
                    usage.modelId(), usage.requests(), usage.inputTokens(), usage.outputTokens(), usage.cost()));
        }
        if (!llmUsage.isEmpty()) {
            sb.append(String.format("  LLM total ≈ $%.4f%n", getTotalLlmCost()));
        }
        return sb.toString();
    }
}
