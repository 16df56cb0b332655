package com.bubblegrade.modules.report;

/**
 * Summary of a distribution table.
 *
 * @param mean         total_fx / total_f, 0 without scores
 * @param plPercentage performance level: mean as a percentage of total points
 * @param mps          PL + (100 - PL) * 0.02
 * @param hso          highest score observed
 * @param lso          lowest score observed
 */
public record PerformanceStatistics(
        long totalF,
        long totalFx,
        double mean,
        double plPercentage,
        double mps,
        double hso,
        double lso) {

    /** Same figures rounded to two decimals for display. */
    public PerformanceStatistics rounded() {
        return new PerformanceStatistics(totalF, totalFx,
                Rounding.twoDecimals(mean),
                Rounding.twoDecimals(plPercentage),
                Rounding.twoDecimals(mps),
                Rounding.twoDecimals(hso),
                Rounding.twoDecimals(lso));
    }
}
