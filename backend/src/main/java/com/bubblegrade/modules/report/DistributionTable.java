package com.bubblegrade.modules.report;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Frequency of each integer score from the exam's total points down to 0.
 * Every score has a row, attained or not.
 *
 * <p>Tables for the same exam can be {@linkplain #merge merged}; statistics of
 * a merged table are computed from the summed rows, never from the parts'
 * statistics.
 */
public class DistributionTable {

    private final int top;
    private final long[] frequencies;
    private double highest = Double.NEGATIVE_INFINITY;
    private double lowest = Double.POSITIVE_INFINITY;

    public DistributionTable(int top) {
        if (top < 0) {
            throw new IllegalArgumentException("Top score must not be negative: " + top);
        }
        this.top = top;
        this.frequencies = new long[top + 1];
    }

    /** Table sized for an exam worth {@code totalPoints}, rounded to the nearest integer. */
    public static DistributionTable forTotalPoints(double totalPoints) {
        return new DistributionTable((int) Math.round(totalPoints));
    }

    /** Counts one student's score in the row of its rounded value. */
    public void add(double pointsEarned) {
        if (Double.isNaN(pointsEarned) || Double.isInfinite(pointsEarned)) {
            return;
        }
        int score = (int) Math.max(0, Math.min(top, Math.round(pointsEarned)));
        frequencies[score]++;
        highest = Math.max(highest, pointsEarned);
        lowest = Math.min(lowest, pointsEarned);
    }

    public static DistributionTable merge(int top, Collection<DistributionTable> tables) {
        DistributionTable merged = new DistributionTable(top);
        for (DistributionTable table : tables) {
            if (table.top != top) {
                throw new IllegalArgumentException("Cannot merge tables of " + table.top + " and " + top + " points");
            }
            for (int score = 0; score <= top; score++) {
                merged.frequencies[score] += table.frequencies[score];
            }
            if (!table.isEmpty()) {
                merged.highest = Math.max(merged.highest, table.highest);
                merged.lowest = Math.min(merged.lowest, table.lowest);
            }
        }
        return merged;
    }

    public int top() {
        return top;
    }

    public boolean isEmpty() {
        return totalF() == 0;
    }

    /** Rows from the top score down to 0. */
    public List<DistributionRow> rows() {
        List<DistributionRow> rows = new ArrayList<>(top + 1);
        for (int score = top; score >= 0; score--) {
            rows.add(new DistributionRow(score, frequencies[score], frequencies[score] * score));
        }
        return rows;
    }

    public long totalF() {
        long total = 0;
        for (long f : frequencies) {
            total += f;
        }
        return total;
    }

    public long totalFx() {
        long total = 0;
        for (int score = 0; score <= top; score++) {
            total += frequencies[score] * score;
        }
        return total;
    }

    public double hso() {
        return isEmpty() ? 0 : highest;
    }

    public double lso() {
        return isEmpty() ? 0 : lowest;
    }

    /** Full-precision statistics against the exam's total points. */
    public PerformanceStatistics statistics(double totalPoints) {
        long totalF = totalF();
        long totalFx = totalFx();
        double mean = totalF > 0 ? (double) totalFx / totalF : 0;
        double pl = totalPoints > 0 ? (mean / totalPoints) * 100 : 0;
        double mps = pl + (100 - pl) * 0.02;
        return new PerformanceStatistics(totalF, totalFx, mean, pl, mps, hso(), lso());
    }
}
