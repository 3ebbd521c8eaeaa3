package com.oru.governance.domain.model;

/**
 * Per-step reduction applied by the metrics backend.
 */
public enum MetricAggregation {
    /**
     * Average rate of a cumulative counter, used for CPU seconds.
     */
    AVERAGE_RATE,

    /**
     * Maximum gauge value within each step, used for memory working set.
     */
    MAX_OVER_TIME;

    public static MetricAggregation forKind(ResourceKind kind) {
        return kind == ResourceKind.CPU ? AVERAGE_RATE : MAX_OVER_TIME;
    }
}
