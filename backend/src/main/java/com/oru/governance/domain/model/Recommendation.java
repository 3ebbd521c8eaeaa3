package com.oru.governance.domain.model;

import lombok.Builder;

import java.util.Objects;

/**
 * Percentile-based sizing suggestion for one target and resource kind.
 *
 * Suggested values are canonical units (millicores, bytes) and are always
 * null when confidence is {@link Confidence#INSUFFICIENT_DATA}; the note then
 * says why.
 */
@Builder
public record Recommendation(
        WorkloadTarget target,
        ResourceKind resourceKind,
        Confidence confidence,
        Long suggestedRequest,
        Long suggestedLimit,
        double percentile,
        TimeRange window,
        int sampleCount,
        Double observedPercentile,
        Double observedPeak,
        Double variationCoefficient,
        String note
) {

    public Recommendation {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(resourceKind, "resourceKind");
        Objects.requireNonNull(confidence, "confidence");
        if (confidence == Confidence.INSUFFICIENT_DATA && (suggestedRequest != null || suggestedLimit != null)) {
            throw new IllegalArgumentException("insufficient-data recommendation must not carry numbers");
        }
    }

    public static Recommendation insufficient(WorkloadTarget target, ResourceKind kind, double percentile,
                                              TimeRange window, int sampleCount, String note) {
        return builder()
                .target(target)
                .resourceKind(kind)
                .confidence(Confidence.INSUFFICIENT_DATA)
                .percentile(percentile)
                .window(window)
                .sampleCount(sampleCount)
                .note(note)
                .build();
    }

    public boolean hasSuggestion() {
        return suggestedRequest != null;
    }
}
