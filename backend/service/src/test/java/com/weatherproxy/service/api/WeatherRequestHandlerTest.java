package com.weatherproxy.service.api;

import com.weatherproxy.core.model.ForecastResult;
import com.weatherproxy.core.model.WeatherResponse;
import com.weatherproxy.service.nws.ForecastResolution;
import com.weatherproxy.service.nws.ResolutionErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class WeatherRequestHandlerTest {
    private final AtomicInteger resolverCalls = new AtomicInteger();

    @Test
    void missingParametersAreRejected() {
        WeatherRequestHandler handler = handlerReturning(sunny(85));

        assertBadRequest(handler.handle(Map.of()), "Missing required parameters: lat and lon");
        assertBadRequest(handler.handle(Map.of("lat", "40.7")), "Missing required parameters: lat and lon");
        assertBadRequest(handler.handle(Map.of("lon", "-74")), "Missing required parameters: lat and lon");
        assertBadRequest(handler.handle(Map.of("lat", "", "lon", "-74")), "Missing required parameters: lat and lon");
        assertEquals(0, resolverCalls.get());
    }

    @Test
    void formatIsCheckedLatitudeFirst() {
        WeatherRequestHandler handler = handlerReturning(sunny(85));

        assertBadRequest(handler.handle(query("abc", "-74")), "Invalid latitude format");
        assertBadRequest(handler.handle(query("abc", "xyz")), "Invalid latitude format");
        assertBadRequest(handler.handle(query("40.7", "xyz")), "Invalid longitude format");
        assertBadRequest(handler.handle(query("NaN", "-74")), "Invalid latitude format");
        assertBadRequest(handler.handle(query("40.7", "Infinity")), "Invalid longitude format");
        assertBadRequest(handler.handle(query("40.7d", "-74")), "Invalid latitude format");
        assertBadRequest(handler.handle(query(" 40.7", "-74")), "Invalid latitude format");
        assertEquals(0, resolverCalls.get());
    }

    @Test
    void rangeIsCheckedLatitudeFirst() {
        WeatherRequestHandler handler = handlerReturning(sunny(85));

        assertBadRequest(handler.handle(query("91", "-74")), "Latitude must be between -90 and 90");
        assertBadRequest(handler.handle(query("-91", "-74")), "Latitude must be between -90 and 90");
        assertBadRequest(handler.handle(query("100", "200")), "Latitude must be between -90 and 90");
        assertBadRequest(handler.handle(query("40", "181")), "Longitude must be between -180 and 180");
        assertBadRequest(handler.handle(query("40", "-180.0001")), "Longitude must be between -180 and 180");
        assertEquals(0, resolverCalls.get());
    }

    @Test
    void successClassifiesAndFormatsCoordinates() {
        WeatherRequestHandler handler = handlerReturning(sunny(85));

        WeatherRequestHandler.HandlerResponse response = handler.handle(query("40.7128", "-74.0060"));

        assertEquals(200, response.status());
        assertEquals(new WeatherResponse("Sunny", "hot", "40.7128, -74.0060", null), response.body());
        assertEquals(1, resolverCalls.get());
    }

    @Test
    void bucketFollowsConvertedTemperature() {
        WeatherRequestHandler cold = handlerReturning(ForecastResolution.success(new ForecastResult("Snow", 4, "C")));
        WeatherRequestHandler moderate = handlerReturning(ForecastResolution.success(new ForecastResult("Cloudy", 41, "F")));

        assertEquals("cold", cold.handle(query("47.6062", "-122.3321")).body().temperature());
        assertEquals("moderate", moderate.handle(query("47.6062", "-122.3321")).body().temperature());
    }

    @Test
    void rangeBoundariesAreAccepted() {
        WeatherRequestHandler handler = handlerReturning(sunny(60));

        assertEquals(200, handler.handle(query("90", "180")).status());
        assertEquals(200, handler.handle(query("-90", "-180")).status());
    }

    @Test
    void coverageAndGridFailuresSurfaceResolverMessage() {
        String outside = "coordinates (51.5074, -0.1278) are outside NWS coverage area (US and territories only)";
        String notFound = "coordinates (40.7128, -74.0060) not found in NWS grid system - may be outside coverage area";

        assertBadRequest(
                handlerReturning(ForecastResolution.failure(ResolutionErrorKind.OUT_OF_COVERAGE, outside)).handle(query("51.5074", "-0.1278")),
                outside
        );
        assertBadRequest(
                handlerReturning(ForecastResolution.failure(ResolutionErrorKind.GRID_NOT_FOUND, notFound)).handle(query("40.7128", "-74.0060")),
                notFound
        );
    }

    @Test
    void upstreamFailuresAreGenericServerErrors() {
        for (ResolutionErrorKind kind : ResolutionErrorKind.values()) {
            if (kind.clientFacing()) {
                continue;
            }
            WeatherRequestHandler handler = handlerReturning(
                    ForecastResolution.failure(kind, "upstream detail 503", new IOException("boom"))
            );

            WeatherRequestHandler.HandlerResponse response = handler.handle(query("40.7128", "-74.0060"));

            assertEquals(500, response.status(), kind.name());
            assertEquals("Failed to retrieve weather data", response.body().errorMessage());
            assertNull(response.body().forecast());
        }
    }

    private WeatherRequestHandler handlerReturning(ForecastResolution resolution) {
        return new WeatherRequestHandler((lat, lon) -> {
            resolverCalls.incrementAndGet();
            return resolution;
        });
    }

    private static ForecastResolution sunny(int temperatureF) {
        return ForecastResolution.success(new ForecastResult("Sunny", temperatureF, "F"));
    }

    private static Map<String, String> query(String lat, String lon) {
        Map<String, String> query = new HashMap<>();
        query.put("lat", lat);
        query.put("lon", lon);
        return query;
    }

    private static void assertBadRequest(WeatherRequestHandler.HandlerResponse response, String message) {
        assertEquals(400, response.status());
        assertEquals(message, response.body().errorMessage());
        assertNull(response.body().forecast());
        assertNull(response.body().temperature());
        assertNull(response.body().coordinates());
    }
}
