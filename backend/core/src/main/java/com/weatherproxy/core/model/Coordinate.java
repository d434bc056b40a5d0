package com.weatherproxy.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public record Coordinate(double latitude, double longitude) {
    public String format() {
        return formatDegrees(latitude) + ", " + formatDegrees(longitude);
    }

    /**
     * Four-decimal text of a degree value, rounded half-even on the exact binary value
     * (so 40.71275, stored just below the tie, gives 40.7127). Negative values keep their
     * sign even when they round to zero.
     */
    public static String formatDegrees(double value) {
        if (!Double.isFinite(value)) {
            return String.valueOf(value);
        }
        String text = new BigDecimal(value).setScale(4, RoundingMode.HALF_EVEN).toPlainString();
        if (Double.doubleToRawLongBits(value) < 0 && !text.startsWith("-")) {
            return "-" + text;
        }
        return text;
    }
}
