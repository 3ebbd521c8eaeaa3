package com.oru.governance.adapters;

import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSampleSeries;

/**
 * Port interface for the time-series backend.
 *
 * Implementations must return values in canonical units (millicores for CPU,
 * bytes for memory) and must be safe to call from several threads at once.
 */
public interface MetricsAdapter {

    /**
     * Runs one range query.
     *
     * @return the samples, or an empty series when the backend holds no data
     * @throws com.oru.governance.domain.exception.MetricsQueryException on any backend failure
     */
    MetricSampleSeries query(MetricQuerySpec spec);
}
