package com.eventbacktest.backtester.domain.strategy;

/**
 * Ordinary least squares helpers for pairs trading.
 * The regression has no intercept: y = beta * x.
 */
public final class HedgeRatioRegression {

    private HedgeRatioRegression() {
    }

    /**
     * Least squares slope of y on x through the origin.
     *
     * @return the hedge ratio, or NaN if x is all zeros
     */
    public static double hedgeRatio(double[] y, double[] x) {
        if (y.length != x.length || y.length == 0) {
            throw new IllegalArgumentException("Series must be non-empty and of equal length");
        }
        double sumXY = 0.0;
        double sumXX = 0.0;
        for (int i = 0; i < x.length; i++) {
            sumXY += x[i] * y[i];
            sumXX += x[i] * x[i];
        }
        if (sumXX == 0.0) {
            return Double.NaN;
        }
        return sumXY / sumXX;
    }

    /**
     * Residual spread y - beta * x.
     */
    public static double[] spread(double[] y, double[] x, double hedgeRatio) {
        double[] spread = new double[y.length];
        for (int i = 0; i < y.length; i++) {
            spread[i] = y[i] - hedgeRatio * x[i];
        }
        return spread;
    }

    /**
     * Z-score of the last element against the mean and population standard
     * deviation of the whole series.
     *
     * @return the z-score, or NaN if the series has zero dispersion
     */
    public static double zScoreOfLast(double[] series) {
        double mean = 0.0;
        for (double value : series) {
            mean += value;
        }
        mean /= series.length;

        double variance = 0.0;
        for (double value : series) {
            variance += (value - mean) * (value - mean);
        }
        double stdDev = Math.sqrt(variance / series.length);

        if (stdDev < 1e-12) {
            return Double.NaN;
        }
        return (series[series.length - 1] - mean) / stdDev;
    }
}
