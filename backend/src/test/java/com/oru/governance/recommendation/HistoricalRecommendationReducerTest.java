package com.oru.governance.recommendation;

import com.oru.governance.domain.model.Confidence;
import com.oru.governance.domain.model.GovernanceOptions;
import com.oru.governance.domain.model.MetricQuerySpec;
import com.oru.governance.domain.model.MetricSample;
import com.oru.governance.domain.model.MetricSampleSeries;
import com.oru.governance.domain.model.Recommendation;
import com.oru.governance.domain.model.ResourceKind;
import com.oru.governance.domain.model.TimeRange;
import com.oru.governance.domain.model.WorkloadTarget;
import com.oru.governance.metrics.QueryOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for HistoricalRecommendationReducer.
 *
 * Test strategy:
 * 1. Data sufficiency gates (sample count, span, unusable values)
 * 2. Percentile, rounding, floor note and limit derivation
 * 3. Seasonality flag is advisory only
 * 4. Non-successful query outcomes map to insufficient data
 */
class HistoricalRecommendationReducerTest {

    // Wednesday, so short series stay within weekdays
    private static final Instant START = Instant.parse("2024-01-10T00:00:00Z");
    private static final WorkloadTarget TARGET = new WorkloadTarget("payments", "api", "app");
    private static final long MI = 1L << 20;

    private final HistoricalRecommendationReducer reducer =
            new HistoricalRecommendationReducer(new SeasonalityDetector());
    private final GovernanceOptions options = GovernanceOptions.defaults();

    @Nested
    @DisplayName("Data sufficiency")
    class SufficiencyTests {

        @Test
        @DisplayName("Should return insufficient data with no numbers below the minimum sample count")
        void shouldRequireMinimumSamples() {
            // Given 9 samples, one short of the default minimum
            MetricSampleSeries series = series(9, Duration.ofMinutes(10), i -> 150);

            // When
            Recommendation recommendation = reduce(ResourceKind.CPU, series);

            // Then
            assertThat(recommendation.confidence()).isEqualTo(Confidence.INSUFFICIENT_DATA);
            assertThat(recommendation.suggestedRequest()).isNull();
            assertThat(recommendation.suggestedLimit()).isNull();
            assertThat(recommendation.observedPercentile()).isNull();
            assertThat(recommendation.sampleCount()).isEqualTo(9);
            assertThat(recommendation.note()).contains("9 usable samples");
        }

        @Test
        @DisplayName("Should require the samples to span the minimum data window")
        void shouldRequireMinimumSpan() {
            // 30 samples one minute apart only cover 29 minutes
            MetricSampleSeries series = series(30, Duration.ofMinutes(1), i -> 150);

            Recommendation recommendation = reduce(ResourceKind.CPU, series);

            assertThat(recommendation.confidence()).isEqualTo(Confidence.INSUFFICIENT_DATA);
            assertThat(recommendation.note()).contains("span");
        }

        @Test
        @DisplayName("Should ignore NaN, infinite and negative samples")
        void shouldDropUnusableSamples() {
            // Given 12 points of which 4 are unusable
            List<MetricSample> samples = new ArrayList<>(series(8, Duration.ofMinutes(15), i -> 100).samples());
            samples.add(new MetricSample(START.plusSeconds(60), Double.NaN));
            samples.add(new MetricSample(START.plusSeconds(120), Double.POSITIVE_INFINITY));
            samples.add(new MetricSample(START.plusSeconds(180), -5));
            samples.add(new MetricSample(START.plusSeconds(240), Double.NEGATIVE_INFINITY));

            // When
            Recommendation recommendation = reduce(ResourceKind.CPU, new MetricSampleSeries(samples));

            // Then
            assertThat(recommendation.confidence()).isEqualTo(Confidence.INSUFFICIENT_DATA);
            assertThat(recommendation.sampleCount()).isEqualTo(8);
        }

        @Test
        @DisplayName("Should treat an empty series as insufficient data")
        void shouldHandleEmptySeries() {
            assertThat(reduce(ResourceKind.MEMORY, MetricSampleSeries.empty()).confidence())
                    .isEqualTo(Confidence.INSUFFICIENT_DATA);
        }
    }

    @Nested
    @DisplayName("Sizing")
    class SizingTests {

        @Test
        @DisplayName("Should size CPU from P95 of 100 samples between 100m and 200m")
        void shouldSizeFromPercentile() {
            // Given 100 samples spread evenly over 100m..200m, shuffled in time
            List<Double> values = new ArrayList<>();
            for (int i = 0; i < 100; i++) {
                values.add(100 + i * (100.0 / 99));
            }
            Collections.shuffle(values, new Random(7));
            MetricSampleSeries series = series(100, Duration.ofMinutes(1), values::get);

            // When
            Recommendation recommendation = reduce(ResourceKind.CPU, series);

            // Then
            assertThat(recommendation.confidence()).isEqualTo(Confidence.SUFFICIENT_DATA);
            assertThat(recommendation.suggestedRequest()).isBetween(190L, 200L);
            assertThat(recommendation.suggestedLimit())
                    .isEqualTo((long) Math.ceil(recommendation.suggestedRequest() * options.getCpuLimitRatio()));
            assertThat(recommendation.observedPeak()).isEqualTo(200.0, org.assertj.core.data.Offset.offset(1e-9));
            assertThat(recommendation.sampleCount()).isEqualTo(100);
            assertThat(recommendation.percentile()).isEqualTo(95.0);
        }

        @Test
        @DisplayName("Should keep the observed percentile below the validation floor and say so in the note")
        void shouldReportRequestBelowFloor() {
            MetricSampleSeries series = series(20, Duration.ofMinutes(5), i -> 2);

            Recommendation recommendation = reduce(ResourceKind.CPU, series);

            assertThat(recommendation.confidence()).isEqualTo(Confidence.SUFFICIENT_DATA);
            assertThat(recommendation.suggestedRequest()).isEqualTo(2L);
            assertThat(recommendation.suggestedLimit()).isEqualTo(6L);
            assertThat(recommendation.note())
                    .contains("below the minimum of 10m")
                    .contains("below-minimum-request");
        }

        @Test
        @DisplayName("Should leave the note empty when the request clears the floor")
        void shouldNotNoteRequestAboveFloor() {
            Recommendation recommendation = reduce(ResourceKind.CPU, series(20, Duration.ofMinutes(5), i -> 150));

            assertThat(recommendation.suggestedRequest()).isEqualTo(150L);
            assertThat(recommendation.note()).isNull();
        }

        @Test
        @DisplayName("Should round memory up to whole MiB")
        void shouldRoundMemoryToGranularity() {
            // Given a steady working set of 200.3 MiB
            MetricSampleSeries series = series(20, Duration.ofMinutes(5), i -> 200.3 * MI);

            // When
            Recommendation recommendation = reduce(ResourceKind.MEMORY, series);

            // Then
            assertThat(recommendation.suggestedRequest()).isEqualTo(201 * MI);
            assertThat(recommendation.suggestedLimit()).isEqualTo(603 * MI);
        }

        @Test
        @DisplayName("Should be deterministic for the same series")
        void shouldBeDeterministic() {
            MetricSampleSeries series = series(50, Duration.ofMinutes(5), i -> 100 + (i * 37 % 50));

            assertThat(reduce(ResourceKind.CPU, series)).isEqualTo(reduce(ResourceKind.CPU, series));
        }
    }

    @Nested
    @DisplayName("Seasonality")
    class SeasonalityTests {

        @Test
        @DisplayName("Should flag weekday/weekend divergence without changing the numbers")
        void shouldFlagSeasonalPattern() {
            // Given a week of hourly samples: busy weekdays, idle weekend
            MetricSampleSeries series = series(7 * 24, Duration.ofHours(1), i -> {
                int day = (START.plus(Duration.ofHours(i)).atZone(java.time.ZoneOffset.UTC).getDayOfWeek().getValue());
                return day >= 6 ? 10 : 400;
            });

            // When
            Recommendation seasonal = reduce(ResourceKind.CPU, series);
            Recommendation unflagged = reducer.reduce(TARGET, ResourceKind.CPU, window(),
                    series, options.toBuilder().seasonalityThreshold(100).build());

            // Then
            assertThat(seasonal.confidence()).isEqualTo(Confidence.SEASONAL_PATTERN_DETECTED);
            assertThat(seasonal.variationCoefficient()).isGreaterThan(0.5);
            assertThat(seasonal.note()).contains("cv=");
            assertThat(unflagged.confidence()).isEqualTo(Confidence.SUFFICIENT_DATA);
            assertThat(seasonal.suggestedRequest()).isEqualTo(unflagged.suggestedRequest());
            assertThat(seasonal.suggestedLimit()).isEqualTo(unflagged.suggestedLimit());
        }

        @Test
        @DisplayName("Should not flag steady usage")
        void shouldNotFlagSteadyUsage() {
            MetricSampleSeries series = series(7 * 24, Duration.ofHours(1), i -> 200 + (i % 5));

            assertThat(reduce(ResourceKind.CPU, series).confidence()).isEqualTo(Confidence.SUFFICIENT_DATA);
        }
    }

    @Nested
    @DisplayName("Query outcomes")
    class OutcomeTests {

        private final MetricQuerySpec spec = MetricQuerySpec.create(TARGET, ResourceKind.CPU, window(),
                Duration.ofMinutes(5), START.plus(Duration.ofDays(1)), 11_000);

        @Test
        @DisplayName("Should explain a timed-out query in the note")
        void shouldMapTimeout() {
            Recommendation recommendation = reducer.reduce(TARGET, ResourceKind.CPU,
                    QueryOutcome.timedOut(spec, "query exceeded timeout of PT30S"), options);

            assertThat(recommendation.confidence()).isEqualTo(Confidence.INSUFFICIENT_DATA);
            assertThat(recommendation.note()).contains("timed out").contains("PT30S");
            assertThat(recommendation.suggestedRequest()).isNull();
        }

        @Test
        @DisplayName("Should explain a failed query in the note")
        void shouldMapFailure() {
            Recommendation recommendation = reducer.reduce(TARGET, ResourceKind.CPU,
                    QueryOutcome.failed(spec, "503 Service Unavailable", 2), options);

            assertThat(recommendation.confidence()).isEqualTo(Confidence.INSUFFICIENT_DATA);
            assertThat(recommendation.note()).contains("503");
        }

        @Test
        @DisplayName("Should reduce the series of a succeeded query")
        void shouldReduceSucceeded() {
            MetricSampleSeries series = series(48, Duration.ofMinutes(30), i -> 120);

            Recommendation recommendation = reducer.reduce(TARGET, ResourceKind.CPU,
                    QueryOutcome.completed(spec, series, 1), options);

            assertThat(recommendation.suggestedRequest()).isEqualTo(120L);
            assertThat(recommendation.suggestedLimit()).isEqualTo(360L);
            assertThat(recommendation.window()).isEqualTo(spec.range());
        }
    }

    // Helper methods

    private Recommendation reduce(ResourceKind kind, MetricSampleSeries series) {
        return reducer.reduce(TARGET, kind, window(), series, options);
    }

    private static TimeRange window() {
        return TimeRange.of(START, START.plus(Duration.ofDays(1)));
    }

    private static MetricSampleSeries series(int count, Duration step, IntToDoubleFunction value) {
        List<MetricSample> samples = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            samples.add(new MetricSample(START.plus(step.multipliedBy(i)), value.applyAsDouble(i)));
        }
        return new MetricSampleSeries(samples);
    }
}
