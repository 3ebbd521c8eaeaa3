package com.oru.governance.recommendation;

/**
 * Order statistics over sorted samples.
 */
final class Percentiles {

    private Percentiles() {
    }

    /**
     * Linear interpolation between closest ranks (the "R-7" definition).
     *
     * @param sorted     ascending, non-empty values
     * @param percentile in (0, 100]
     */
    static double percentile(double[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("no values");
        }
        if (sorted.length == 1) {
            return sorted[0];
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return values.length == 0 ? 0 : sum / values.length;
    }

    /**
     * Population standard deviation over mean; 0 when the mean is 0 or
     * fewer than two values exist.
     */
    static double coefficientOfVariation(double[] values) {
        if (values.length < 2) {
            return 0;
        }
        double mean = mean(values);
        if (mean == 0) {
            return 0;
        }
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.length) / mean;
    }
}
