package com.weatherproxy.service.nws;

@FunctionalInterface
public interface ForecastResolver {
    ForecastResolution resolve(double lat, double lon);
}
