package com.oru.governance.domain.model;

/**
 * How much trust a sizing recommendation deserves.
 */
public enum Confidence {
    SUFFICIENT_DATA("sufficient-data"),

    /**
     * Too few usable samples; the recommendation carries no numbers.
     */
    INSUFFICIENT_DATA("insufficient-data"),

    /**
     * Numbers are computed but usage varies strongly between sub-windows.
     * A single percentile may not fit every period.
     */
    SEASONAL_PATTERN_DETECTED("seasonal-pattern-detected");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
