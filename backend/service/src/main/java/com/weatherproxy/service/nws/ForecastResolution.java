package com.weatherproxy.service.nws;

import com.weatherproxy.core.model.ForecastResult;

/**
 * Outcome of a coordinate-to-forecast lookup. Exactly one of {@code forecast} and {@code error} is set.
 */
public record ForecastResolution(ForecastResult forecast, ResolutionError error) {
    public static ForecastResolution success(ForecastResult forecast) {
        return new ForecastResolution(forecast, null);
    }

    public static ForecastResolution failure(ResolutionErrorKind kind, String message) {
        return new ForecastResolution(null, new ResolutionError(kind, message));
    }

    public static ForecastResolution failure(ResolutionErrorKind kind, String message, Throwable cause) {
        return new ForecastResolution(null, new ResolutionError(kind, message, cause));
    }

    public boolean success() {
        return error == null;
    }

    public String shortForecast() {
        return forecast.shortForecast();
    }

    public int temperatureF() {
        return forecast.temperatureFahrenheit();
    }
}
