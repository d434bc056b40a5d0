package com.weatherproxy.core.model;

/**
 * First forecast period as reported upstream, before any unit conversion.
 */
public record ForecastResult(
        String shortForecast,
        int temperatureValue,
        String temperatureUnit
) {
    public int temperatureFahrenheit() {
        return TemperatureConversion.toFahrenheit(temperatureValue, temperatureUnit);
    }

    public boolean reportedInCelsius() {
        return TemperatureConversion.isCelsius(temperatureUnit);
    }
}
