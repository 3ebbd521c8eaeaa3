package com.oru.governance.domain.model;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-target section of a report: classification plus one recommendation per kind.
 */
public record WorkloadEntry(
        WorkloadTarget target,
        String controllerKind,
        int podCount,
        Duration age,
        WorkloadCategory category,
        Map<ResourceKind, Recommendation> recommendations
) {

    public WorkloadEntry {
        EnumMap<ResourceKind, Recommendation> copy = new EnumMap<>(ResourceKind.class);
        if (recommendations != null) {
            copy.putAll(recommendations);
        }
        recommendations = Collections.unmodifiableMap(copy);
    }

    public Recommendation recommendation(ResourceKind kind) {
        return recommendations.get(kind);
    }
}
