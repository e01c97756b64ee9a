package com.score.reconciliation.analysis;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Agreement between two aggregate maps over the canonical ids they share.
 * Correlations are {@code NaN} with fewer than two shared ids or when either
 * side has no variance.
 *
 * @param sharedIds canonical ids present in both maps, sorted
 * @param left      scores of the first map, aligned with {@code sharedIds}
 * @param right     scores of the second map, aligned with {@code sharedIds}
 * @param pearson   Pearson correlation of the paired scores
 * @param spearman  Spearman rank correlation, ties ranked by their average position
 */
public record RankingAgreement(
        List<String> sharedIds,
        List<Double> left,
        List<Double> right,
        double pearson,
        double spearman
) {
    public RankingAgreement {
        sharedIds = List.copyOf(sharedIds);
        left = List.copyOf(left);
        right = List.copyOf(right);
    }

    public static RankingAgreement compare(Map<String, Double> a, Map<String, Double> b) {
        TreeSet<String> shared = new TreeSet<>(a.keySet());
        shared.retainAll(b.keySet());

        List<String> ids = new ArrayList<>(shared);
        double[] x = new double[ids.size()];
        double[] y = new double[ids.size()];
        List<Double> left = new ArrayList<>(ids.size());
        List<Double> right = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            x[i] = a.get(ids.get(i));
            y[i] = b.get(ids.get(i));
            left.add(x[i]);
            right.add(y[i]);
        }
        return new RankingAgreement(ids, left, right, pearson(x, y), pearson(ranks(x), ranks(y)));
    }

    public int sharedCount() {
        return sharedIds.size();
    }

    public boolean isEmpty() {
        return sharedIds.isEmpty();
    }

    static double pearson(double[] x, double[] y) {
        int n = x.length;
        if (n < 2) {
            return Double.NaN;
        }
        double meanX = Arrays.stream(x).average().orElse(0);
        double meanY = Arrays.stream(y).average().orElse(0);
        double cov = 0;
        double varX = 0;
        double varY = 0;
        for (int i = 0; i < n; i++) {
            double dx = x[i] - meanX;
            double dy = y[i] - meanY;
            cov += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX == 0 || varY == 0) {
            return Double.NaN;
        }
        return cov / Math.sqrt(varX * varY);
    }

    /**
     * 1-based ranks; tied values share the mean of the positions they occupy.
     */
    static double[] ranks(double[] values) {
        int n = values.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));

        double[] ranks = new double[n];
        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && values[order[end + 1]] == values[order[start]]) {
                end++;
            }
            double rank = (start + end) / 2.0 + 1;
            for (int k = start; k <= end; k++) {
                ranks[order[k]] = rank;
            }
            start = end + 1;
        }
        return ranks;
    }
}
