package com.oru.governance.domain.model;

import com.oru.governance.domain.exception.InvalidConfigurationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Half-open historical window {@code [start, end)}.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new InvalidConfigurationException("time range bounds must be set");
        }
        if (!start.isBefore(end)) {
            throw new InvalidConfigurationException(
                    "time range start " + start + " must be before end " + end);
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public static TimeRange lastHours(Clock clock, long hours) {
        return last(clock, Duration.ofHours(hours));
    }

    public static TimeRange lastDays(Clock clock, long days) {
        return last(clock, Duration.ofDays(days));
    }

    public static TimeRange last(Clock clock, Duration window) {
        Instant end = clock.instant();
        return new TimeRange(end.minus(window), end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    /**
     * Returns this range with its end moved back to {@code now} when it lies in the future.
     */
    public TimeRange clampEnd(Instant now) {
        return end.isAfter(now) ? new TimeRange(start, now) : this;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
