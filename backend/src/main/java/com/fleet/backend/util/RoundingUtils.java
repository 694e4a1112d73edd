package com.fleet.backend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class RoundingUtils {

    public static final int DISPLAY_SCALE = 2;

    private RoundingUtils() {
    }

    /**
     * Half-up rounding to two decimals on the shortest decimal representation of {@code value}.
     * Non-finite values are returned unchanged.
     */
    public static double round2(double value) {
        return round(value, DISPLAY_SCALE);
    }

    public static double round(double value, int scale) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
