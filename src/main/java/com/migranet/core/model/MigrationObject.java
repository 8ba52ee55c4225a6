package com.migranet.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Objects;

/**
 * MigrationObject: one schema object travelling through the migration workflow.
 *
 * Owned exclusively by MigrationOrchestrator while it is processed. Status moves
 * forward only (see MigrationStatus); once DEPLOYED or UNRESOLVED the object is
 * frozen and every mutator throws IllegalStateException.
 */
public class MigrationObject {

    private static final Logger log = LoggerFactory.getLogger(MigrationObject.class);

    private final String     name;
    private final String     schema;
    private final ObjectKind kind;

    // Owning package for PACKAGE_MEMBER objects, null otherwise
    private final String parentPackage;

    private String          sourceDefinition;
    private String          targetDefinition;
    private MigrationStatus status;

    private MigrationObject(String name, String schema, ObjectKind kind,
                            String parentPackage, String sourceDefinition) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Object name cannot be empty");
        }
        this.name             = name.trim();
        this.schema           = schema != null ? schema.trim() : null;
        this.kind             = Objects.requireNonNull(kind, "kind");
        this.parentPackage    = parentPackage;
        this.sourceDefinition = sourceDefinition;
        this.status           = MigrationStatus.NEW;
    }

    public static MigrationObject of(String schema, String name, ObjectKind kind) {
        return new MigrationObject(name, schema, kind, null, null);
    }

    /** Object whose source text is already known (no fetch needed). */
    public static MigrationObject withSource(String schema, String name, ObjectKind kind, String source) {
        return new MigrationObject(name, schema, kind, null, source);
    }

    public static MigrationObject packageMember(String schema, String packageName, String memberName) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("Package member requires its package name");
        }
        return new MigrationObject(memberName, schema, ObjectKind.PACKAGE_MEMBER, packageName.trim(), null);
    }

    // =========================================================================
    // Identity
    // =========================================================================

    public String     getName()          { return name; }
    public String     getSchema()        { return schema; }
    public ObjectKind getKind()          { return kind; }
    public String     getParentPackage() { return parentPackage; }

    /** SCHEMA.NAME (or PACKAGE.MEMBER for package members), used in logs and reports. */
    public String getQualifiedName() {
        String local = parentPackage != null ? parentPackage + "." + name : name;
        return schema != null && !schema.isEmpty() ? schema + "." + local : local;
    }

    /** Case-insensitive key used by the memory store sections. */
    public String getMemoryKey() {
        return name.toUpperCase(Locale.ROOT);
    }

    // =========================================================================
    // Definitions
    // =========================================================================

    public String getSourceDefinition() { return sourceDefinition; }

    public boolean hasSourceDefinition() {
        return sourceDefinition != null && !sourceDefinition.isBlank();
    }

    public void setSourceDefinition(String sourceDefinition) {
        requireMutable();
        this.sourceDefinition = sourceDefinition;
    }

    public String getTargetDefinition() { return targetDefinition; }

    public void setTargetDefinition(String targetDefinition) {
        requireMutable();
        this.targetDefinition = targetDefinition;
    }

    // =========================================================================
    // Status
    // =========================================================================

    public MigrationStatus getStatus() { return status; }

    public void transitionTo(MigrationStatus next) {
        if (status == next) return;
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for " + getQualifiedName() + ": " + status + " → " + next);
        }
        log.debug("[Object] {} status {} → {}", getQualifiedName(), status, next);
        this.status = next;
    }

    private void requireMutable() {
        if (status.isTerminal()) {
            throw new IllegalStateException(getQualifiedName() + " is " + status + " and can no longer change");
        }
    }

    @Override
    public String toString() {
        return "MigrationObject{" + kind + " " + getQualifiedName() + ", status=" + status + "}";
    }
}
