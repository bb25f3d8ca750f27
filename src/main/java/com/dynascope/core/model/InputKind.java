package com.dynascope.core.model;

/**
 * The file families a result directory may contain.
 * <p>
 * The high-speed-printer log and the message logs form the required set: a run
 * is analysable when at least one of them is present.
 */
public enum InputKind {

    HSP("d3hsp", true),
    GLSTAT("glstat", false),
    STATUS("status.out", false),
    MATSUM("matsum", false),
    MESSAGE("messag", true),
    NODOUT("nodout", false),
    BNDOUT("bndout", false),
    LOAD_PROFILE("load_profile.csv", false),
    CONTACT_PROFILE("cont_profile.csv", false),
    INPUT_DECK("input deck", false);

    private final String label;
    private final boolean required;

    InputKind(String label, boolean required) {
        this.label = label;
        this.required = required;
    }

    public String label() {
        return label;
    }

    /** Whether this family belongs to the minimum input set. */
    public boolean required() {
        return required;
    }
}
