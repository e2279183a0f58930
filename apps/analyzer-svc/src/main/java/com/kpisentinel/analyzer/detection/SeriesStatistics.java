package com.kpisentinel.analyzer.detection;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/** Population statistics; percentiles use the R-7 estimator. */
public final class SeriesStatistics {

    private SeriesStatistics() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Mean().evaluate(values);
    }

    /** Population (biased) standard deviation. */
    public static double populationStd(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new StandardDeviation(false).evaluate(values);
    }

    /**
     * Percentile with linear interpolation between the closest ranks (R type 7), so that
     * {@code percentile(v, 25)} of {@code 1..5} is 2.0.
     */
    public static double percentile(double[] values, double percentile) {
        if (values.length == 0) {
            return Double.NaN;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, percentile);
    }

    public static double median(double[] values) {
        return percentile(values, 50);
    }

    /** Signed percentage change of {@code value} against {@code baseline}; 0 for a zero baseline. */
    public static double percentChange(double value, double baseline) {
        if (baseline == 0 || !Double.isFinite(baseline)) {
            return 0d;
        }
        return (value - baseline) / baseline * 100;
    }
}
