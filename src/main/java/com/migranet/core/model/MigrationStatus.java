package com.migranet.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Explicit status graph for a single object's migration.
 *
 * NEW → FETCHED → CONVERTED → REVIEWED → DEPLOYED
 *                                      ↘ REPAIRING → DEPLOYED | UNRESOLVED
 *
 * Any non-terminal status may drop straight to UNRESOLVED (fetch or conversion
 * failure). DEPLOYED and UNRESOLVED are terminal.
 */
public enum MigrationStatus {
    NEW,
    FETCHED,
    CONVERTED,
    REVIEWED,
    DEPLOYED,
    REPAIRING,
    UNRESOLVED;

    public boolean isTerminal() {
        return this == DEPLOYED || this == UNRESOLVED;
    }

    public boolean canMoveTo(MigrationStatus next) {
        return allowedNext().contains(next);
    }

    private Set<MigrationStatus> allowedNext() {
        return switch (this) {
            case NEW        -> EnumSet.of(FETCHED, UNRESOLVED);
            case FETCHED    -> EnumSet.of(CONVERTED, UNRESOLVED);
            case CONVERTED  -> EnumSet.of(REVIEWED, UNRESOLVED);
            case REVIEWED   -> EnumSet.of(DEPLOYED, REPAIRING, UNRESOLVED);
            case REPAIRING  -> EnumSet.of(DEPLOYED, UNRESOLVED);
            case DEPLOYED, UNRESOLVED -> EnumSet.noneOf(MigrationStatus.class);
        };
    }
}
