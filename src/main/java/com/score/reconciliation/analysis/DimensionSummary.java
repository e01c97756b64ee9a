package com.score.reconciliation.analysis;

import com.score.reconciliation.join.DataPoint;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Mean score per dimension value and the least-squares trend of score over
 * dimension across all data points.
 */
public final class DimensionSummary {

    private final Map<Integer, Double> meanByDimension;
    private final int pointCount;
    private final Double slope;
    private final Double intercept;

    private DimensionSummary(Map<Integer, Double> meanByDimension, int pointCount,
                             Double slope, Double intercept) {
        this.meanByDimension = Collections.unmodifiableMap(meanByDimension);
        this.pointCount = pointCount;
        this.slope = slope;
        this.intercept = intercept;
    }

    public static DimensionSummary of(List<DataPoint> points) {
        Map<Integer, double[]> sums = new TreeMap<>();
        double sumX = 0;
        double sumY = 0;
        for (DataPoint point : points) {
            double[] acc = sums.computeIfAbsent(point.dimensionValue(), k -> new double[2]);
            acc[0] += point.score();
            acc[1]++;
            sumX += point.dimensionValue();
            sumY += point.score();
        }

        Map<Integer, Double> means = new TreeMap<>();
        sums.forEach((dimension, acc) -> means.put(dimension, acc[0] / acc[1]));

        int n = points.size();
        Double slope = null;
        Double intercept = null;
        if (n >= 2) {
            double meanX = sumX / n;
            double meanY = sumY / n;
            double sxx = 0;
            double sxy = 0;
            for (DataPoint point : points) {
                double dx = point.dimensionValue() - meanX;
                sxx += dx * dx;
                sxy += dx * (point.score() - meanY);
            }
            if (sxx > 0) {
                slope = sxy / sxx;
                intercept = meanY - slope * meanX;
            }
        }
        return new DimensionSummary(means, n, slope, intercept);
    }

    /**
     * Dimension values in ascending order with the mean score of their points.
     */
    public Map<Integer, Double> getMeanByDimension() {
        return meanByDimension;
    }

    public int getPointCount() {
        return pointCount;
    }

    public boolean hasTrend() {
        return slope != null;
    }

    public OptionalDouble getSlope() {
        return slope != null ? OptionalDouble.of(slope) : OptionalDouble.empty();
    }

    public OptionalDouble getIntercept() {
        return intercept != null ? OptionalDouble.of(intercept) : OptionalDouble.empty();
    }

    /**
     * Trend value at {@code x}; empty without a trend.
     */
    public OptionalDouble predict(double x) {
        return slope != null ? OptionalDouble.of(intercept + slope * x) : OptionalDouble.empty();
    }

    @Override
    public String toString() {
        return "DimensionSummary{points=" + pointCount +
                ", dimensions=" + meanByDimension.size() +
                ", slope=" + slope +
                ", intercept=" + intercept + '}';
    }
}
