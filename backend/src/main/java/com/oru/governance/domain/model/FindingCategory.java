package com.oru.governance.domain.model;

public enum FindingCategory {
    /**
     * Declared requests/limits violate capacity-management practice.
     */
    CONFIGURATION,

    /**
     * Inventory data could not be interpreted or was incomplete.
     */
    DATA_QUALITY,

    /**
     * Declared requests diverge from observed usage.
     */
    USAGE
}
