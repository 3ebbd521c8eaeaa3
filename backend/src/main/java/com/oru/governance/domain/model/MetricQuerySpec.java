package com.oru.governance.domain.model;

import com.oru.governance.domain.exception.InvalidConfigurationException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One historical query: a target, a resource kind and how to sample it.
 *
 * Instances are only created through {@link #create}, which enforces that
 * the window does not reach past the issue time and that the series size
 * stays within {@code maxSamples}. {@code controllerKind} is null when the
 * workload's controller is unknown; backends then match any generated pod
 * name shape.
 */
public record MetricQuerySpec(
        WorkloadTarget target,
        ResourceKind resourceKind,
        MetricAggregation aggregation,
        TimeRange range,
        Duration step,
        Instant issuedAt,
        String controllerKind
) {

    public MetricQuerySpec {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(resourceKind, "resourceKind");
        Objects.requireNonNull(aggregation, "aggregation");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(issuedAt, "issuedAt");
        if (step == null || step.isZero() || step.isNegative()) {
            throw new InvalidConfigurationException("query step must be positive: " + step);
        }
        if (range.end().isAfter(issuedAt)) {
            throw new InvalidConfigurationException(
                    "query window end " + range.end() + " is later than issue time " + issuedAt);
        }
    }

    public static MetricQuerySpec create(WorkloadTarget target, ResourceKind kind, TimeRange range,
                                         Duration step, Instant issuedAt, long maxSamples) {
        return create(target, null, kind, range, step, issuedAt, maxSamples);
    }

    public static MetricQuerySpec create(WorkloadTarget target, String controllerKind, ResourceKind kind,
                                         TimeRange range, Duration step, Instant issuedAt, long maxSamples) {
        MetricQuerySpec spec = new MetricQuerySpec(
                target, kind, MetricAggregation.forKind(kind), range, step, issuedAt, controllerKind);
        if (spec.expectedSamples() > maxSamples) {
            throw new InvalidConfigurationException(String.format(
                    "query for %s %s would return %d samples, above the bound of %d",
                    target, kind, spec.expectedSamples(), maxSamples));
        }
        return spec;
    }

    public long expectedSamples() {
        return range.duration().toMillis() / step.toMillis() + 1;
    }
}
