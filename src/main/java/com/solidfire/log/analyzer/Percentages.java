package com.solidfire.log.analyzer;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Percentage arithmetic used by the reports. Values are rounded to one decimal place,
 * half up (ties away from zero), computed exactly from the counts. A zero denominator
 * yields 0.0.
 */
public final class Percentages {

    private Percentages() {
    }

    public static double of(long part, long total) {
        if (total <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(part * 100L)
                .divide(BigDecimal.valueOf(total), 1, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static String format(double percentage) {
        return BigDecimal.valueOf(percentage).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }
}
