package com.migranet.core.memory;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A fix that once made a deployment error go away, keyed by error signature.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ErrorSolution {

    private final String         signature;
    private final String         solutionText;
    private final SolutionSource provenance;
    private final Instant        recordedAt;

    @JsonCreator
    public ErrorSolution(
            @JsonProperty("signature")     String signature,
            @JsonProperty("solution")      String solutionText,
            @JsonProperty("provenance")    SolutionSource provenance,
            @JsonProperty("recorded_at")   Instant recordedAt
    ) {
        this.signature    = Objects.requireNonNull(signature, "signature");
        this.solutionText = solutionText != null ? solutionText : "";
        this.provenance   = provenance != null ? provenance : SolutionSource.TRANSLATOR;
        this.recordedAt   = recordedAt != null ? recordedAt : Instant.now();
    }

    public static ErrorSolution of(String signature, String solutionText, SolutionSource provenance) {
        return new ErrorSolution(signature, solutionText, provenance, Instant.now());
    }

    @JsonProperty("signature")   public String         getSignature()    { return signature; }
    @JsonProperty("solution")    public String         getSolutionText() { return solutionText; }
    @JsonProperty("provenance")  public SolutionSource getProvenance()   { return provenance; }
    @JsonProperty("recorded_at") public Instant        getRecordedAt()   { return recordedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ErrorSolution)) return false;
        ErrorSolution that = (ErrorSolution) o;
        return signature.equals(that.signature)
                && solutionText.equals(that.solutionText)
                && provenance == that.provenance
                && recordedAt.equals(that.recordedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(signature, solutionText, provenance, recordedAt);
    }

    @Override
    public String toString() {
        return "ErrorSolution{" + signature + ", " + provenance + ", " + recordedAt + "}";
    }
}
