package com.weatherproxy.service.api;

import com.weatherproxy.core.classify.TemperatureClassifier;
import com.weatherproxy.core.model.Coordinate;
import com.weatherproxy.core.model.TemperatureBucket;
import com.weatherproxy.core.model.WeatherResponse;
import com.weatherproxy.service.nws.ForecastResolution;
import com.weatherproxy.service.nws.ForecastResolver;
import com.weatherproxy.service.nws.ResolutionError;

import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns the query of a {@code /weather} request into a status and response body.
 * Independent of the HTTP server so the validation and error mapping can be exercised directly.
 */
public final class WeatherRequestHandler {
    private static final Logger LOGGER = Logger.getLogger(WeatherRequestHandler.class.getName());

    static final String MISSING_PARAMETERS = "Missing required parameters: lat and lon";
    static final String INVALID_LATITUDE = "Invalid latitude format";
    static final String INVALID_LONGITUDE = "Invalid longitude format";
    static final String LATITUDE_RANGE = "Latitude must be between -90 and 90";
    static final String LONGITUDE_RANGE = "Longitude must be between -180 and 180";
    static final String GENERIC_FAILURE = "Failed to retrieve weather data";

    private final ForecastResolver resolver;

    public WeatherRequestHandler(ForecastResolver resolver) {
        this.resolver = resolver;
    }

    public HandlerResponse handle(Map<String, String> query) {
        String latRaw = query.get("lat");
        String lonRaw = query.get("lon");
        if (latRaw == null || latRaw.isEmpty() || lonRaw == null || lonRaw.isEmpty()) {
            return HandlerResponse.badRequest(MISSING_PARAMETERS);
        }

        Double lat = parseCoordinate(latRaw);
        if (lat == null) {
            return HandlerResponse.badRequest(INVALID_LATITUDE);
        }
        Double lon = parseCoordinate(lonRaw);
        if (lon == null) {
            return HandlerResponse.badRequest(INVALID_LONGITUDE);
        }

        if (lat < -90 || lat > 90) {
            return HandlerResponse.badRequest(LATITUDE_RANGE);
        }
        if (lon < -180 || lon > 180) {
            return HandlerResponse.badRequest(LONGITUDE_RANGE);
        }

        Coordinate coordinate = new Coordinate(lat, lon);
        ForecastResolution resolution = resolver.resolve(coordinate.latitude(), coordinate.longitude());
        if (!resolution.success()) {
            ResolutionError error = resolution.error();
            LOGGER.log(Level.WARNING, "Error getting weather data: " + error.kind() + ": " + error.message(), error.cause());
            if (error.clientFacing()) {
                return HandlerResponse.badRequest(error.message());
            }
            return new HandlerResponse(500, WeatherResponse.error(GENERIC_FAILURE));
        }

        TemperatureBucket bucket = TemperatureClassifier.classify(resolution.temperatureF());
        return new HandlerResponse(200, WeatherResponse.success(resolution.shortForecast(), bucket, coordinate));
    }

    // Stricter than Double.parseDouble: no surrounding whitespace, no 'd'/'f' suffix, finite values only.
    private static Double parseCoordinate(String raw) {
        if (!raw.equals(raw.trim())) {
            return null;
        }
        char last = Character.toLowerCase(raw.charAt(raw.length() - 1));
        if (last == 'd' || last == 'f') {
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public record HandlerResponse(int status, WeatherResponse body) {
        static HandlerResponse badRequest(String message) {
            return new HandlerResponse(400, WeatherResponse.error(message));
        }
    }
}
