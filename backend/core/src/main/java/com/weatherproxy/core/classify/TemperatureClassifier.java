package com.weatherproxy.core.classify;

import com.weatherproxy.core.model.TemperatureBucket;

public final class TemperatureClassifier {
    public static final int HOT_THRESHOLD_F = 80;
    public static final int COLD_THRESHOLD_F = 40;

    private TemperatureClassifier() {
    }

    public static TemperatureBucket classify(int tempF) {
        if (tempF >= HOT_THRESHOLD_F) {
            return TemperatureBucket.HOT;
        }
        if (tempF <= COLD_THRESHOLD_F) {
            return TemperatureBucket.COLD;
        }
        return TemperatureBucket.MODERATE;
    }
}
