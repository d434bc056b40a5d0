package com.weatherproxy.core.model;

import java.util.Locale;

public final class TemperatureConversion {
    private TemperatureConversion() {
    }

    public static boolean isCelsius(String unit) {
        return unit != null && "C".equals(unit.toUpperCase(Locale.ROOT));
    }

    /**
     * Converts an upstream reading to whole degrees Fahrenheit.
     * Celsius values are truncated toward zero after conversion; every other unit,
     * including unrecognised ones, is passed through as Fahrenheit.
     */
    public static int toFahrenheit(int value, String unit) {
        if (!isCelsius(unit)) {
            return value;
        }
        return (int) ((double) value * 9 / 5 + 32);
    }
}
