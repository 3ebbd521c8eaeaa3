package com.oru.governance.domain.model;

/**
 * Ordered identifiers of every finding the engine can emit.
 *
 * Declaration order is the evaluation and reporting order: configuration
 * rules first, then data quality, then usage comparisons.
 */
public enum RuleId {
    MISSING_REQUEST("missing-request", FindingCategory.CONFIGURATION),
    MISSING_LIMIT("missing-limit", FindingCategory.CONFIGURATION),
    RATIO_OUT_OF_BOUNDS("ratio-out-of-bounds", FindingCategory.CONFIGURATION),
    BELOW_MINIMUM_REQUEST("below-minimum-request", FindingCategory.CONFIGURATION),
    MALFORMED_QUANTITY("malformed-quantity", FindingCategory.DATA_QUALITY),
    MISSING_METADATA("missing-metadata", FindingCategory.DATA_QUALITY),
    INVENTORY_FAILURE("inventory-failure", FindingCategory.DATA_QUALITY),
    REQUEST_OVER_PROVISIONED("request-over-provisioned", FindingCategory.USAGE),
    REQUEST_UNDER_PROVISIONED("request-under-provisioned", FindingCategory.USAGE);

    private final String id;
    private final FindingCategory category;

    RuleId(String id, FindingCategory category) {
        this.id = id;
        this.category = category;
    }

    public String getId() {
        return id;
    }

    public FindingCategory getCategory() {
        return category;
    }

    @Override
    public String toString() {
        return id;
    }
}
