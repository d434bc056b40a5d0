package com.weatherproxy.service.nws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.weatherproxy.core.coverage.CoverageChecker;
import com.weatherproxy.core.coverage.CoverageRegion;
import com.weatherproxy.core.model.Coordinate;
import com.weatherproxy.core.model.ForecastResult;
import com.weatherproxy.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Resolves a coordinate to its current forecast through the National Weather Service API:
 * a points lookup yields the forecast URL, which is then fetched. Neither call is retried.
 */
public final class NwsForecastClient implements ForecastResolver {
    private static final Logger LOGGER = Logger.getLogger(NwsForecastClient.class.getName());
    // Trailing content after the JSON document is a parse failure.
    private static final ObjectReader BODY_READER = JsonUtils.objectMapper().reader()
            .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final String userAgent;

    public NwsForecastClient(HttpClient httpClient, String baseUrl, Duration timeout, String userAgent) {
        String scheme = URI.create(baseUrl).getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("NWS base URL must be http or https: " + baseUrl);
        }
        this.httpClient = httpClient;
        this.baseUrl = baseUrl;
        this.timeout = timeout;
        this.userAgent = userAgent;
    }

    @Override
    public ForecastResolution resolve(double lat, double lon) {
        String coordinates = new Coordinate(lat, lon).format();
        Optional<CoverageRegion> region = CoverageChecker.regionFor(lat, lon);
        if (region.isEmpty()) {
            return ForecastResolution.failure(
                    ResolutionErrorKind.OUT_OF_COVERAGE,
                    "coordinates (" + coordinates + ") are outside NWS coverage area (US and territories only)"
            );
        }
        LOGGER.info("Fetching weather for coordinates: " + coordinates + " (" + region.get().name() + ")");

        URI pointsUri = URI.create(baseUrl + "/points/" + Coordinate.formatDegrees(lat) + "," + Coordinate.formatDegrees(lon));
        LOGGER.info("Calling NWS grid points API: " + pointsUri);
        HttpResponse<String> pointsResponse;
        try {
            pointsResponse = get(pointsUri);
        } catch (IOException e) {
            return ForecastResolution.failure(ResolutionErrorKind.UPSTREAM_UNREACHABLE, "failed to get grid points", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ForecastResolution.failure(ResolutionErrorKind.UPSTREAM_UNREACHABLE, "interrupted while getting grid points", e);
        }
        LOGGER.info("Grid points API response status: " + pointsResponse.statusCode());

        if (pointsResponse.statusCode() == 404) {
            return ForecastResolution.failure(
                    ResolutionErrorKind.GRID_NOT_FOUND,
                    "coordinates (" + coordinates + ") not found in NWS grid system - may be outside coverage area"
            );
        }
        if (pointsResponse.statusCode() != 200) {
            return ForecastResolution.failure(
                    ResolutionErrorKind.UPSTREAM_ERROR,
                    "grid points API returned status: " + pointsResponse.statusCode()
            );
        }

        URI forecastUri;
        try {
            JsonNode root = BODY_READER.readTree(pointsResponse.body());
            if (!root.isObject()) {
                return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "grid response is not a JSON object");
            }
            JsonNode forecastNode = root.path("properties").path("forecast");
            if (!forecastNode.isMissingNode() && !forecastNode.isNull() && !forecastNode.isTextual()) {
                return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "forecast URL in grid response is not text");
            }
            String forecastUrl = forecastNode.asText("");
            if (forecastUrl.isBlank()) {
                return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "no forecast URL found in grid response");
            }
            forecastUri = URI.create(forecastUrl);
        } catch (JsonProcessingException e) {
            return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "failed to parse grid response", e);
        } catch (IllegalArgumentException e) {
            return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "invalid forecast URL in grid response", e);
        }
        LOGGER.info("Forecast URL: " + forecastUri);

        HttpResponse<String> forecastResponse;
        try {
            forecastResponse = get(forecastUri);
        } catch (IllegalArgumentException e) {
            // non-http(s) scheme
            return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "invalid forecast URL in grid response", e);
        } catch (IOException e) {
            return ForecastResolution.failure(ResolutionErrorKind.UPSTREAM_UNREACHABLE, "failed to get forecast", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ForecastResolution.failure(ResolutionErrorKind.UPSTREAM_UNREACHABLE, "interrupted while getting forecast", e);
        }
        LOGGER.info("Forecast API response status: " + forecastResponse.statusCode());

        if (forecastResponse.statusCode() != 200) {
            return ForecastResolution.failure(
                    ResolutionErrorKind.FORECAST_UNAVAILABLE,
                    "forecast API returned status: " + forecastResponse.statusCode()
            );
        }

        ForecastResult result;
        try {
            JsonNode root = BODY_READER.readTree(forecastResponse.body());
            if (!root.isObject()) {
                return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "forecast response is not a JSON object");
            }
            JsonNode periods = root.path("properties").path("periods");
            if (periods.isMissingNode() || periods.isNull() || (periods.isArray() && periods.isEmpty())) {
                return ForecastResolution.failure(ResolutionErrorKind.NO_FORECAST_PERIODS, "no forecast periods found");
            }
            if (!periods.isArray()) {
                return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "forecast periods is not an array");
            }
            result = readPeriod(periods.get(0));
        } catch (JsonProcessingException e) {
            return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, "failed to parse forecast response", e);
        } catch (MalformedPeriodException e) {
            return ForecastResolution.failure(ResolutionErrorKind.MALFORMED_UPSTREAM_RESPONSE, e.getMessage());
        }

        LOGGER.info("Retrieved forecast: " + result.shortForecast()
                + ", Temperature: " + result.temperatureValue() + "°" + result.temperatureUnit());
        if (result.reportedInCelsius()) {
            LOGGER.info("Converted temperature from " + result.temperatureValue() + "°C to " + result.temperatureFahrenheit() + "°F");
        }
        return ForecastResolution.success(result);
    }

    private HttpResponse<String> get(URI uri) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(timeout)
                .header("Accept", "application/geo+json,application/json")
                .header("User-Agent", userAgent)
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    // A null period, and absent or null fields, read as empty text or zero; a field of the wrong type is malformed.
    private static ForecastResult readPeriod(JsonNode period) throws MalformedPeriodException {
        if (period.isNull()) {
            return new ForecastResult("", 0, "");
        }
        if (!period.isObject()) {
            throw new MalformedPeriodException("forecast period is not an object");
        }
        return new ForecastResult(
                readText(period, "shortForecast"),
                readInt(period, "temperature"),
                readText(period, "temperatureUnit")
        );
    }

    private static String readText(JsonNode period, String field) throws MalformedPeriodException {
        JsonNode value = period.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return "";
        }
        if (!value.isTextual()) {
            throw new MalformedPeriodException("forecast period field " + field + " is not text");
        }
        return value.asText();
    }

    private static int readInt(JsonNode period, String field) throws MalformedPeriodException {
        JsonNode value = period.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return 0;
        }
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new MalformedPeriodException("forecast period field " + field + " is not an integer");
        }
        return value.intValue();
    }

    private static final class MalformedPeriodException extends Exception {
        MalformedPeriodException(String message) {
            super(message);
        }
    }
}
