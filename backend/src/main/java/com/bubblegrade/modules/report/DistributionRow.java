package com.bubblegrade.modules.report;

/**
 * One score of a distribution table: how many students got it and the
 * product of the two.
 */
public record DistributionRow(int score, long f, long fx) {
}
