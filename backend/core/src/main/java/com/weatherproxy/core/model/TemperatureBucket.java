package com.weatherproxy.core.model;

public enum TemperatureBucket {
    HOT("hot"),
    COLD("cold"),
    MODERATE("moderate");

    private final String label;

    TemperatureBucket(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
