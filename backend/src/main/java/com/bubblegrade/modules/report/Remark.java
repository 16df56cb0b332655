package com.bubblegrade.modules.report;

/**
 * Mastery bucket of a question by the share of students who answered it correctly.
 */
public enum Remark {
    /** Mastered: 75% or more */
    M,
    /** Nearly mastered: 60% or more */
    NM,
    /** Not mastered */
    NTM;

    public static Remark of(double percentage) {
        if (percentage >= 75) {
            return M;
        }
        if (percentage >= 60) {
            return NM;
        }
        return NTM;
    }
}
