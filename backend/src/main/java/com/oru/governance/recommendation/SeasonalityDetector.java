package com.oru.governance.recommendation;

import com.oru.governance.domain.model.MetricSample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Measures how much usage differs between sub-windows of a series.
 *
 * WINDOWS:
 * - weekday vs weekend (UTC) when the series covers both
 * - otherwise {@code windows} equal time slices
 *
 * The score is the coefficient of variation of the window means.
 */
@Slf4j
@Component
public class SeasonalityDetector {

    public double variation(List<MetricSample> samples, int windows) {
        List<double[]> groups = weekdayWeekend(samples);
        if (groups.size() < 2) {
            groups = slices(samples, windows);
        }
        double[] means = groups.stream().mapToDouble(Percentiles::mean).toArray();
        double variation = Percentiles.coefficientOfVariation(means);
        log.trace("Sub-window means {} give variation {}", means, variation);
        return variation;
    }

    private List<double[]> weekdayWeekend(List<MetricSample> samples) {
        List<Double> weekday = new ArrayList<>();
        List<Double> weekend = new ArrayList<>();
        for (MetricSample sample : samples) {
            DayOfWeek day = sample.timestamp().atOffset(ZoneOffset.UTC).getDayOfWeek();
            (day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? weekend : weekday).add(sample.value());
        }
        List<double[]> groups = new ArrayList<>();
        if (!weekday.isEmpty() && !weekend.isEmpty()) {
            groups.add(toArray(weekday));
            groups.add(toArray(weekend));
        }
        return groups;
    }

    private List<double[]> slices(List<MetricSample> samples, int windows) {
        List<List<Double>> buckets = new ArrayList<>();
        for (int i = 0; i < windows; i++) {
            buckets.add(new ArrayList<>());
        }
        long start = samples.get(0).timestamp().toEpochMilli();
        long span = Math.max(1, Duration.between(samples.get(0).timestamp(),
                samples.get(samples.size() - 1).timestamp()).toMillis());
        for (MetricSample sample : samples) {
            long offset = sample.timestamp().toEpochMilli() - start;
            int index = (int) Math.min(windows - 1, offset * windows / span);
            buckets.get(index).add(sample.value());
        }
        return buckets.stream().filter(b -> !b.isEmpty()).map(SeasonalityDetector::toArray).toList();
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
