package com.migranet.core.repair;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.migranet.core.classifier.DeploymentErrorKind;
import com.migranet.core.memory.SolutionSource;

/**
 * Immutable record of one deploy call inside the repair loop.
 *
 * fixApplied is the patched text produced after this attempt failed (the text the
 * next attempt deploys); null on success, on the last attempt, or when the
 * translator could not produce a fix.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class DeploymentAttempt {

    public enum Outcome {
        SUCCESS,
        FAILED
    }

    private final int                 index;
    private final Outcome             outcome;
    private final String              rawError;
    private final DeploymentErrorKind errorKind;
    private final String              signature;
    private final String              fixApplied;
    private final SolutionSource      fixProvenance;
    private final int                 memoryHits;
    private final int                 searchHits;

    private DeploymentAttempt(Builder b) {
        this.index         = b.index;
        this.outcome       = b.outcome;
        this.rawError      = b.rawError;
        this.errorKind     = b.errorKind;
        this.signature     = b.signature;
        this.fixApplied    = b.fixApplied;
        this.fixProvenance = b.fixProvenance;
        this.memoryHits    = b.memoryHits;
        this.searchHits    = b.searchHits;
    }

    @JsonProperty("index")          public int                 getIndex()         { return index; }
    @JsonProperty("outcome")        public Outcome             getOutcome()       { return outcome; }
    @JsonProperty("raw_error")      public String              getRawError()      { return rawError; }
    @JsonProperty("error_kind")     public DeploymentErrorKind getErrorKind()     { return errorKind; }
    @JsonProperty("signature")      public String              getSignature()     { return signature; }
    @JsonProperty("fix_applied")    public String              getFixApplied()    { return fixApplied; }
    @JsonProperty("fix_provenance") public SolutionSource      getFixProvenance() { return fixProvenance; }
    @JsonProperty("memory_hits")    public int                 getMemoryHits()    { return memoryHits; }
    @JsonProperty("search_hits")    public int                 getSearchHits()    { return searchHits; }

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    /** Compact line for logs and the unresolved report's plain-text history. */
    public String toSummaryLine() {
        if (isSuccess()) {
            return "Attempt #" + index + ": SUCCESS";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Attempt #").append(index).append(": FAILED [").append(errorKind.getCode()).append("] ");
        sb.append(firstLine(rawError));
        if (memoryHits > 0 || searchHits > 0) {
            sb.append(" (memory=").append(memoryHits).append(", search=").append(searchHits).append(")");
        }
        if (fixApplied != null) {
            sb.append(" → fix from ").append(fixProvenance.getCode());
        }
        return sb.toString();
    }

    private static String firstLine(String text) {
        if (text == null) return "";
        int nl = text.indexOf('\n');
        return nl >= 0 ? text.substring(0, nl) : text;
    }

    @Override
    public String toString() {
        return toSummaryLine();
    }

    public static Builder builder(int index) {
        return new Builder(index);
    }

    public static final class Builder {
        private final int           index;
        private Outcome             outcome = Outcome.FAILED;
        private String              rawError;
        private DeploymentErrorKind errorKind;
        private String              signature;
        private String              fixApplied;
        private SolutionSource      fixProvenance;
        private int                 memoryHits;
        private int                 searchHits;

        private Builder(int index) {
            if (index < 1) {
                throw new IllegalArgumentException("Attempt index is 1-based, got " + index);
            }
            this.index = index;
        }

        public Builder outcome(Outcome v)                 { this.outcome = v; return this; }
        public Builder rawError(String v)                 { this.rawError = v; return this; }
        public Builder errorKind(DeploymentErrorKind v)   { this.errorKind = v; return this; }
        public Builder signature(String v)                { this.signature = v; return this; }
        public Builder memoryHits(int v)                  { this.memoryHits = v; return this; }
        public Builder searchHits(int v)                  { this.searchHits = v; return this; }

        public Builder fix(String text, SolutionSource provenance) {
            this.fixApplied    = text;
            this.fixProvenance = provenance;
            return this;
        }

        public DeploymentAttempt build() {
            if (outcome == Outcome.FAILED && errorKind == null) {
                errorKind = DeploymentErrorKind.UNKNOWN;
            }
            return new DeploymentAttempt(this);
        }
    }
}
