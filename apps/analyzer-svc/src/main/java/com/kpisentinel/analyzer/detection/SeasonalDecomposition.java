package com.kpisentinel.analyzer.detection;

import java.util.Arrays;
import org.apache.commons.math3.stat.regression.SimpleRegression;

/**
 * Additive decomposition {@code value = trend + seasonal + residual} over a fixed period.
 *
 * <p>The trend is a centred moving average (a 2xp filter for even periods). The positions the
 * filter cannot reach are filled by a least-squares line through the nearest {@code period}
 * trend points on each side. The seasonal component is the per-phase mean of the detrended
 * series, shifted so the phases sum to zero. Components hold {@code NaN} where they are undefined.
 */
record SeasonalDecomposition(double[] trend, double[] seasonal, double[] residual) {

    static SeasonalDecomposition additive(double[] values, int period) {
        if (period < 2) {
            throw new IllegalArgumentException("period must be at least 2");
        }
        if (values.length < 2 * period) {
            throw new IllegalArgumentException("need at least two full periods, got " + values.length + " points");
        }
        double[] trend = centredMovingAverage(values, period);
        extrapolateEdges(trend, period, values.length);

        int n = values.length;
        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = values[i] - trend[i];
        }

        double[] phaseMeans = new double[period];
        for (int phase = 0; phase < period; phase++) {
            double sum = 0;
            int count = 0;
            for (int i = phase; i < n; i += period) {
                if (!Double.isNaN(detrended[i])) {
                    sum += detrended[i];
                    count++;
                }
            }
            phaseMeans[phase] = count == 0 ? Double.NaN : sum / count;
        }
        double centre = Arrays.stream(phaseMeans).sum() / period;

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = phaseMeans[i % period] - centre;
            residual[i] = detrended[i] - seasonal[i];
        }
        return new SeasonalDecomposition(trend, seasonal, residual);
    }

    private static double[] centredMovingAverage(double[] values, int period) {
        double[] filter;
        if (period % 2 == 0) {
            filter = new double[period + 1];
            Arrays.fill(filter, 1d / period);
            filter[0] = 0.5d / period;
            filter[period] = 0.5d / period;
        } else {
            filter = new double[period];
            Arrays.fill(filter, 1d / period);
        }
        int half = filter.length / 2;
        double[] trend = new double[values.length];
        Arrays.fill(trend, Double.NaN);
        for (int centreIndex = half; centreIndex < values.length - half; centreIndex++) {
            double sum = 0;
            for (int j = 0; j < filter.length; j++) {
                sum += filter[j] * values[centreIndex - half + j];
            }
            trend[centreIndex] = sum;
        }
        return trend;
    }

    private static void extrapolateEdges(double[] trend, int points, int n) {
        int front = 0;
        while (front < n && Double.isNaN(trend[front])) {
            front++;
        }
        int back = n - 1;
        while (back >= 0 && Double.isNaN(trend[back])) {
            back--;
        }
        if (front == 0 && back == n - 1) {
            return;
        }
        SimpleRegression head = fitRange(trend, front, Math.min(front + points, back));
        for (int i = 0; i < front; i++) {
            trend[i] = head.predict(i);
        }
        SimpleRegression tail = fitRange(trend, Math.max(front, back - points), back);
        for (int i = back + 1; i < n; i++) {
            trend[i] = tail.predict(i);
        }
    }

    /** Least-squares line over {@code trend[from, to)}. */
    private static SimpleRegression fitRange(double[] trend, int from, int to) {
        SimpleRegression regression = new SimpleRegression();
        for (int i = from; i < to; i++) {
            regression.addData(i, trend[i]);
        }
        return regression;
    }
}
