package com.migranet.core.classifier;

/**
 * Classification of target-side deployment failures.
 *
 * Different failure kinds call for different repair strategies:
 * - SYNTAX: converted code is not valid target dialect
 * - MISSING_OBJECT: a referenced table, schema or routine is absent
 * - TYPE_MISMATCH: data type mapping is wrong
 * - PERMISSION: the deploying login lacks rights
 * - IDENTITY_COLUMN: identity / IDENTITY_INSERT handling
 * - TIMEOUT: the deployment call exceeded its time budget
 * - UNKNOWN: nothing in the rule table matched
 */
public enum DeploymentErrorKind {

    SYNTAX("syntax"),
    MISSING_OBJECT("missing-object"),
    TYPE_MISMATCH("type-mismatch"),
    PERMISSION("permission"),
    IDENTITY_COLUMN("identity-column"),
    TIMEOUT("timeout"),
    UNKNOWN("unknown");

    private final String code;

    DeploymentErrorKind(String code) {
        this.code = code;
    }

    /** Stable code used inside error signatures. */
    public String getCode() { return code; }
}
