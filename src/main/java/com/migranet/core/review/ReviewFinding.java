package com.migranet.core.review;

import java.util.Objects;

public final class ReviewFinding {

    public enum Severity {
        CRITICAL,
        WARNING,
        INFO
    }

    private final Severity severity;
    private final String   message;

    public ReviewFinding(Severity severity, String message) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message  = message != null ? message : "";
    }

    public Severity getSeverity() { return severity; }
    public String   getMessage()  { return message; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReviewFinding)) return false;
        ReviewFinding that = (ReviewFinding) o;
        return severity == that.severity && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message);
    }

    @Override
    public String toString() {
        return severity + ": " + message;
    }
}
