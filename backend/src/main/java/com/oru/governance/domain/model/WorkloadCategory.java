package com.oru.governance.domain.model;

public enum WorkloadCategory {
    /**
     * Younger than the configured new-workload age; history is still forming.
     */
    NEW,

    /**
     * Carries at least one configuration finding of WARNING or above.
     */
    OUTLIER,

    COMPLIANT
}
