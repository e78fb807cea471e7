package com.fleet.anomaly.engine.statistical;

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Median and median absolute deviation of one (unit, feature) group.
 * Computed once per group and used for every row of that group; never shared across groups.
 *
 * modified z = |x - median| / (1.4826 * MAD)
 * The 1.4826 factor makes the MAD a consistent estimate of the standard deviation
 * for normally distributed data.
 */
public final class RobustStatistics {

    public static final double MAD_SCALE = 1.4826;

    private final double median;
    private final double mad;
    private final int sampleCount;

    private RobustStatistics(double median, double mad, int sampleCount) {
        this.median = median;
        this.mad = mad;
        this.sampleCount = sampleCount;
    }

    /**
     * @param values the group's non-missing values, at least one
     */
    public static RobustStatistics of(double[] values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Robust statistics need at least one value");
        }
        Median medianOf = new Median();
        double median = medianOf.evaluate(values);

        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - median);
        }
        double mad = medianOf.evaluate(deviations);
        return new RobustStatistics(median, mad, values.length);
    }

    /**
     * A MAD of zero leaves the z-score undefined; such a group must not be scored.
     */
    public boolean isDegenerate() {
        return mad == 0.0;
    }

    /**
     * Modified z-score of a value; NaN for a missing value.
     */
    public double modifiedZScore(double value) {
        return Math.abs(value - median) / (MAD_SCALE * mad);
    }

    public double getMedian() { return median; }
    public double getMad() { return mad; }
    public int getSampleCount() { return sampleCount; }
}
