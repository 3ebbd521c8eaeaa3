package com.oru.governance.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One point of a historical series, in the canonical unit of its resource kind.
 */
public record MetricSample(Instant timestamp, double value) {

    public MetricSample {
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public boolean isUsable() {
        return Double.isFinite(value) && value >= 0;
    }
}
