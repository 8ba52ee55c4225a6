package com.migranet.core.model;

/**
 * Kinds of schema objects the engine migrates.
 *
 * The label is the form used inside error signatures, e.g. "Table:syntax:...".
 */
public enum ObjectKind {

    TABLE("Table"),
    PROCEDURE("Procedure"),
    FUNCTION("Function"),
    TRIGGER("Trigger"),
    PACKAGE_MEMBER("PackageMember");

    private final String label;

    ObjectKind(String label) {
        this.label = label;
    }

    public String getLabel() { return label; }

    /** Tables travel as DDL; everything else is procedural code. */
    public boolean isStructural() {
        return this == TABLE;
    }
}
