package com.oru.governance.domain.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Timestamp-ordered, immutable samples. Empty means the backend had no data,
 * which is not the same as a series of zeros.
 */
public record MetricSampleSeries(List<MetricSample> samples) {

    private static final MetricSampleSeries EMPTY = new MetricSampleSeries(List.of());

    public MetricSampleSeries {
        List<MetricSample> sorted = new ArrayList<>(samples == null ? List.of() : samples);
        sorted.sort(Comparator.comparing(MetricSample::timestamp));
        samples = List.copyOf(sorted);
    }

    public static MetricSampleSeries empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    public Duration span() {
        if (samples.size() < 2) {
            return Duration.ZERO;
        }
        return Duration.between(samples.get(0).timestamp(), samples.get(samples.size() - 1).timestamp());
    }
}
