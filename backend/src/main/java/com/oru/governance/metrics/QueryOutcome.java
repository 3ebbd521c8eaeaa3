package com.oru.governance.metrics;

import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSampleSeries;

import java.util.Objects;

/**
 * Tracked state of one query. {@code series} is empty unless SUCCEEDED.
 */
public record QueryOutcome(
        MetricQuerySpec spec,
        QueryStatus status,
        MetricSampleSeries series,
        String reason,
        int attempts
) {

    public QueryOutcome {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(status, "status");
        series = series == null ? MetricSampleSeries.empty() : series;
    }

    public static QueryOutcome pending(MetricQuerySpec spec) {
        return new QueryOutcome(spec, QueryStatus.PENDING, null, null, 0);
    }

    /**
     * SUCCEEDED, or EMPTY when the backend returned no samples.
     */
    public static QueryOutcome completed(MetricQuerySpec spec, MetricSampleSeries series, int attempts) {
        if (series == null || series.isEmpty()) {
            return new QueryOutcome(spec, QueryStatus.EMPTY, null, "no samples returned", attempts);
        }
        return new QueryOutcome(spec, QueryStatus.SUCCEEDED, series, null, attempts);
    }

    public static QueryOutcome failed(MetricQuerySpec spec, String reason, int attempts) {
        return new QueryOutcome(spec, QueryStatus.FAILED, null, reason, attempts);
    }

    public static QueryOutcome timedOut(MetricQuerySpec spec, String reason) {
        return new QueryOutcome(spec, QueryStatus.TIMED_OUT, null, reason, 0);
    }

    public boolean isResolved() {
        return status.isTerminal();
    }
}
