package com.bubblegrade.modules.report;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {

    private Rounding() {
    }

    /** Display rounding; never feed the result back into an aggregate. */
    static double twoDecimals(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
