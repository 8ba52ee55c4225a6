package com.migranet.core.repair;

/**
 * Outcome of one deployment call. Failures are values, not exceptions.
 */
public final class DeployResult {

    private final boolean success;
    private final boolean timedOut;
    private final String  rawError;

    private DeployResult(boolean success, boolean timedOut, String rawError) {
        this.success  = success;
        this.timedOut = timedOut;
        this.rawError = rawError;
    }

    public static DeployResult success() {
        return new DeployResult(true, false, null);
    }

    public static DeployResult failed(String rawError) {
        return new DeployResult(false, false, rawError != null ? rawError : "");
    }

    public static DeployResult timedOut(String rawError) {
        return new DeployResult(false, true, rawError);
    }

    public boolean isSuccess()  { return success; }
    public boolean isTimedOut() { return timedOut; }

    /** Null on success. */
    public String getRawError() { return rawError; }

    @Override
    public String toString() {
        return success ? "DeployResult{success}" : "DeployResult{failed: " + rawError + "}";
    }
}
