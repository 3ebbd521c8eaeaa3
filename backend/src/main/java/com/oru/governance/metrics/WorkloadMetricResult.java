package com.oru.governance.metrics;

import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.WorkloadTarget;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * All query outcomes of one target. Only built once every outcome is terminal.
 */
public record WorkloadMetricResult(WorkloadTarget target, Map<ResourceKind, QueryOutcome> outcomes) {

    public WorkloadMetricResult {
        if (outcomes.values().stream().anyMatch(o -> !o.isResolved())) {
            throw new IllegalStateException("unresolved query for " + target);
        }
        EnumMap<ResourceKind, QueryOutcome> copy = new EnumMap<>(ResourceKind.class);
        copy.putAll(outcomes);
        outcomes = Collections.unmodifiableMap(copy);
    }

    public QueryOutcome outcome(ResourceKind kind) {
        return outcomes.get(kind);
    }
}
