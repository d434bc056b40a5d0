package com.weatherproxy.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.weatherproxy.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class WeatherResponseTest {
    @Test
    void successOmitsErrorField() throws Exception {
        WeatherResponse response = WeatherResponse.success(
                "Sunny",
                TemperatureBucket.HOT,
                new Coordinate(40.7128, -74.0060)
        );

        String json = JsonUtils.objectMapper().writeValueAsString(response);

        assertEquals("{\"forecast\":\"Sunny\",\"temperature\":\"hot\",\"coordinates\":\"40.7128, -74.0060\"}", json);
    }

    @Test
    void errorOmitsForecastFields() throws Exception {
        JsonNode tree = JsonUtils.objectMapper().valueToTree(WeatherResponse.error("Invalid latitude format"));

        assertEquals("Invalid latitude format", tree.get("error").asText());
        assertFalse(tree.has("forecast"));
        assertFalse(tree.has("temperature"));
        assertFalse(tree.has("coordinates"));
        assertEquals(1, tree.size());
    }

    @Test
    void coordinateFormatsToFourDecimals() {
        assertEquals("40.7128, -74.0060", new Coordinate(40.7128, -74.006).format());
        assertEquals("25.0000, -80.1918", new Coordinate(25, -80.19181).format());
    }

    @Test
    void roundingFollowsExactBinaryValue() {
        // 40.71275 and 41.87815 are stored just below the tie
        assertEquals("40.7127, -74.0060", new Coordinate(40.71275, -74.0060).format());
        assertEquals("41.8781, -87.6298", new Coordinate(41.87815, -87.6298).format());
        // exact binary ties go to even
        assertEquals("0.0312", Coordinate.formatDegrees(0.03125));
        assertEquals("-0.0938", Coordinate.formatDegrees(-0.09375));
    }

    @Test
    void negativeValuesKeepSignWhenRoundedToZero() {
        assertEquals("-0.0000", Coordinate.formatDegrees(-0.00001));
        assertEquals("-0.0000", Coordinate.formatDegrees(-0.0));
        assertEquals("0.0000", Coordinate.formatDegrees(0.0));
    }
}
