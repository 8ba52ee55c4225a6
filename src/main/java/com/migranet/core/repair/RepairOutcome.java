package com.migranet.core.repair;

import com.migranet.core.model.MigrationStatus;

import java.util.List;

/**
 * Result of RepairLoop.repair: terminal status plus the full attempt history.
 */
public final class RepairOutcome {

    private final MigrationStatus         finalStatus;
    private final List<DeploymentAttempt> attempts;
    private final String                  finalText;
    private final boolean                 failurePatternRecorded;

    public RepairOutcome(MigrationStatus finalStatus, List<DeploymentAttempt> attempts,
                         String finalText, boolean failurePatternRecorded) {
        this.finalStatus            = finalStatus;
        this.attempts               = List.copyOf(attempts);
        this.finalText              = finalText;
        this.failurePatternRecorded = failurePatternRecorded;
    }

    public MigrationStatus         getFinalStatus() { return finalStatus; }
    public List<DeploymentAttempt> getAttempts()    { return attempts; }

    /** Last text that was deployed. */
    public String getFinalText() { return finalText; }

    public boolean isFailurePatternRecorded() { return failurePatternRecorded; }

    public boolean isDeployed() {
        return finalStatus == MigrationStatus.DEPLOYED;
    }

    /** Raw error of the last failed attempt, null when deployed or nothing was attempted. */
    public String getLastError() {
        if (attempts.isEmpty()) return null;
        DeploymentAttempt last = attempts.get(attempts.size() - 1);
        return last.isSuccess() ? null : last.getRawError();
    }
}
