package com.oru.governance.domain.model;

/**
 * Finding severity, declared from most to least severe.
 */
public enum Severity {
    CRITICAL("critical"),
    ERROR("error"),
    WARNING("warning"),
    INFO("info");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * True when this severity ranks equal to or above {@code other}.
     */
    public boolean isAtLeast(Severity other) {
        return this.ordinal() <= other.ordinal();
    }
}
