package com.oru.governance.domain.model;

public enum OvercommitStatus {
    HEALTHY(Severity.INFO),
    WARNING(Severity.WARNING),
    CRITICAL(Severity.CRITICAL),

    /**
     * Capacity was zero, absent or could not be fetched; no ratio is computed.
     */
    CAPACITY_UNKNOWN(Severity.INFO);

    private final Severity severity;

    OvercommitStatus(Severity severity) {
        this.severity = severity;
    }

    public Severity getSeverity() {
        return severity;
    }
}
