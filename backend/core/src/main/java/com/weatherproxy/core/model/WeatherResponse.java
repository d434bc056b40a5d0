package com.weatherproxy.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"forecast", "temperature", "coordinates", "error"})
public record WeatherResponse(
        String forecast,
        String temperature,
        String coordinates,
        @JsonProperty("error") String errorMessage
) {
    public static WeatherResponse success(String forecast, TemperatureBucket temperature, Coordinate coordinate) {
        return new WeatherResponse(forecast, temperature.label(), coordinate.format(), null);
    }

    public static WeatherResponse error(String message) {
        return new WeatherResponse(null, null, null, message);
    }
}
