package com.oru.governance.recommendation;

import com.oru.governance.domain.model.Confidence;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.MetricSample;
import com.oru.governance.domain.model.MetricSampleSeries;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.RuleId;
import com.oru.governance.domain.model.TimeRange;
import com.oru.governance.domain.model.WorkloadTarget;
import com.oru.governance.metrics.QueryOutcome;
import com.oru.governance.metrics.WorkloadMetricResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reduces historical samples into percentile-based sizing recommendations.
 *
 * ALGORITHM:
 * 1. Drop non-finite and negative samples
 * 2. Require {@code minimumSamples} points spanning {@code minimumDataSpan}
 * 3. Request = configured percentile (linear interpolation), rounded up to
 *    the kind's granularity; a request under the validation floor is kept
 *    and called out in the note
 * 4. Limit = request x the kind's limit ratio, rounded up to the granularity
 * 5. Flag seasonal usage when sub-window means vary above the threshold;
 *    the flag is advisory and never changes the numbers
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoricalRecommendationReducer {

    private final SeasonalityDetector seasonalityDetector;

    public Map<WorkloadTarget, Map<ResourceKind, Recommendation>> reduceAll(
            Map<WorkloadTarget, WorkloadMetricResult> results,
            GovernanceOptions options
    ) {
        Map<WorkloadTarget, Map<ResourceKind, Recommendation>> recommendations = new LinkedHashMap<>();
        results.forEach((target, result) -> {
            Map<ResourceKind, Recommendation> byKind = new EnumMap<>(ResourceKind.class);
            result.outcomes().forEach((kind, outcome) -> byKind.put(kind, reduce(target, kind, outcome, options)));
            recommendations.put(target, byKind);
        });
        return recommendations;
    }

    /**
     * Reduces a tracked query outcome; anything but SUCCEEDED gives insufficient data.
     */
    public Recommendation reduce(WorkloadTarget target, ResourceKind kind, QueryOutcome outcome,
                                 GovernanceOptions options) {
        TimeRange window = outcome.spec().range();
        return switch (outcome.status()) {
            case SUCCEEDED -> reduce(target, kind, window, outcome.series(), options);
            case EMPTY -> insufficient(target, kind, window, 0, "no samples returned for " + window, options);
            case FAILED -> insufficient(target, kind, window, 0, "metrics query failed: " + outcome.reason(), options);
            case TIMED_OUT -> insufficient(target, kind, window, 0, "metrics query timed out: " + outcome.reason(), options);
            case PENDING -> insufficient(target, kind, window, 0, "metrics query did not complete", options);
        };
    }

    /**
     * Pure reduction of a series. Same input, same output.
     */
    public Recommendation reduce(WorkloadTarget target, ResourceKind kind, TimeRange window,
                                 MetricSampleSeries series, GovernanceOptions options) {
        List<MetricSample> usable = series.samples().stream().filter(MetricSample::isUsable).toList();

        if (usable.size() < options.getMinimumSamples()) {
            return insufficient(target, kind, window, usable.size(), String.format(
                    "%d usable samples, at least %d required", usable.size(), options.getMinimumSamples()), options);
        }
        Duration span = Duration.between(usable.get(0).timestamp(), usable.get(usable.size() - 1).timestamp());
        if (span.compareTo(options.getMinimumDataSpan()) < 0) {
            return insufficient(target, kind, window, usable.size(), String.format(
                    "samples span %s, at least %s required", span, options.getMinimumDataSpan()), options);
        }

        double[] values = usable.stream().mapToDouble(MetricSample::value).sorted().toArray();
        double observed = Percentiles.percentile(values, options.getPercentile());
        double peak = values[values.length - 1];

        long granularity = options.granularity(kind);
        long request = roundUp(observed, granularity);
        long limit = roundUp(request * options.limitRatio(kind), granularity);

        double variation = seasonalityDetector.variation(usable, options.getSeasonalityWindows());
        Confidence confidence = variation > options.getSeasonalityThreshold()
                ? Confidence.SEASONAL_PATTERN_DETECTED
                : Confidence.SUFFICIENT_DATA;

        List<String> notes = new ArrayList<>();
        if (confidence == Confidence.SEASONAL_PATTERN_DETECTED) {
            notes.add(String.format(Locale.ROOT, "usage varies across sub-windows (cv=%.2f); review peak periods", variation));
        }
        long floor = options.minimumRequest(kind);
        if (request < floor) {
            notes.add(String.format(Locale.ROOT, "suggested request %s is below the minimum of %s; declaring %s avoids %s",
                    kind.format(request), kind.format(floor), kind.format(roundUp(floor, granularity)),
                    RuleId.BELOW_MINIMUM_REQUEST));
        }

        log.debug("{} {}: p{}={} peak={} -> request={} limit={} ({})", target, kind,
                options.getPercentile(), observed, peak, kind.format(request), kind.format(limit), confidence);

        return Recommendation.builder()
                .target(target)
                .resourceKind(kind)
                .confidence(confidence)
                .suggestedRequest(request)
                .suggestedLimit(limit)
                .percentile(options.getPercentile())
                .window(window)
                .sampleCount(usable.size())
                .observedPercentile(observed)
                .observedPeak(peak)
                .variationCoefficient(variation)
                .note(notes.isEmpty() ? null : String.join("; ", notes))
                .build();
    }

    /**
     * Recommendation for a target that was deliberately not queried.
     */
    public Recommendation notQueried(WorkloadTarget target, ResourceKind kind, TimeRange window,
                                     String reason, GovernanceOptions options) {
        return insufficient(target, kind, window, 0, reason, options);
    }

    private Recommendation insufficient(WorkloadTarget target, ResourceKind kind, TimeRange window,
                                        int sampleCount, String note, GovernanceOptions options) {
        return Recommendation.insufficient(target, kind, options.getPercentile(), window, sampleCount, note);
    }

    /**
     * Ceiling to a multiple of {@code granularity}. A tiny tolerance keeps
     * values like 195.00000000000003 from jumping a whole step.
     */
    static long roundUp(double value, long granularity) {
        double steps = Math.ceil(value / granularity - 1e-9);
        return Math.max(0, (long) steps) * granularity;
    }
}
