package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.model.ObjectKind;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of the append-only pattern log: how a past object of some kind ended
 * and what fixed (or failed to fix) it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MigrationPattern {

    public enum Outcome {
        SUCCESS,
        FAILURE
    }

    private final ObjectKind kind;
    private final Outcome    outcome;
    private final String     fixSummary;
    private final String     objectName;
    private final Instant    recordedAt;

    @JsonCreator
    public MigrationPattern(
            @JsonProperty("kind")        ObjectKind kind,
            @JsonProperty("outcome")     Outcome outcome,
            @JsonProperty("fix_summary") String fixSummary,
            @JsonProperty("object_name") String objectName,
            @JsonProperty("recorded_at") Instant recordedAt
    ) {
        this.kind       = Objects.requireNonNull(kind, "kind");
        this.outcome    = Objects.requireNonNull(outcome, "outcome");
        this.fixSummary = fixSummary != null ? fixSummary : "";
        this.objectName = objectName != null ? objectName : "";
        this.recordedAt = recordedAt != null ? recordedAt : Instant.now();
    }

    public static MigrationPattern success(ObjectKind kind, String objectName, String fixSummary) {
        return new MigrationPattern(kind, Outcome.SUCCESS, fixSummary, objectName, Instant.now());
    }

    public static MigrationPattern failure(ObjectKind kind, String objectName, String fixSummary) {
        return new MigrationPattern(kind, Outcome.FAILURE, fixSummary, objectName, Instant.now());
    }

    @JsonProperty("kind")        public ObjectKind getKind()       { return kind; }
    @JsonProperty("outcome")     public Outcome    getOutcome()    { return outcome; }
    @JsonProperty("fix_summary") public String     getFixSummary() { return fixSummary; }
    @JsonProperty("object_name") public String     getObjectName() { return objectName; }
    @JsonProperty("recorded_at") public Instant    getRecordedAt() { return recordedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MigrationPattern)) return false;
        MigrationPattern that = (MigrationPattern) o;
        return kind == that.kind
                && outcome == that.outcome
                && fixSummary.equals(that.fixSummary)
                && objectName.equals(that.objectName)
                && recordedAt.equals(that.recordedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, outcome, fixSummary, objectName, recordedAt);
    }

    @Override
    public String toString() {
        return "MigrationPattern{" + kind + " " + objectName + " " + outcome + "}";
    }
}
