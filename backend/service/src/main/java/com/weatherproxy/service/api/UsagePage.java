package com.weatherproxy.service.api;

import java.util.List;

final class UsagePage {
    private static final List<Example> EXAMPLES = List.of(
            new Example("New York City", "40.7128", "-74.0060"),
            new Example("Los Angeles", "34.0522", "-118.2437"),
            new Example("Chicago", "41.8781", "-87.6298"),
            new Example("Miami", "25.7617", "-80.1918"),
            new Example("Seattle", "47.6062", "-122.3321")
    );

    private static final String HTML = render();

    private UsagePage() {
    }

    static String html() {
        return HTML;
    }

    private static String render() {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n")
                .append("<html>\n")
                .append("<head><title>Weather Service</title></head>\n")
                .append("<body>\n")
                .append("<h1>Weather Service</h1>\n")
                .append("<p>Use the /weather endpoint with latitude and longitude parameters:</p>\n")
                .append("<p><code>/weather?lat=40.7128&amp;lon=-74.0060</code></p>\n")
                .append("<h2>Example US Cities:</h2>\n");
        for (Example example : EXAMPLES) {
            html.append("<p>Example: <a href=\"/weather?lat=").append(example.lat())
                    .append("&amp;lon=").append(example.lon()).append("\">")
                    .append(example.name()).append("</a></p>\n");
        }
        html.append("<h2>Important Note:</h2>\n")
                .append("<p><strong>This service only works for US locations.</strong> ")
                .append("The National Weather Service API covers the United States and its territories only.</p>\n")
                .append("<p>For international locations, coordinates outside the US will return an error.</p>\n")
                .append("</body>\n")
                .append("</html>\n");
        return html.toString();
    }

    private record Example(String name, String lat, String lon) {
    }
}
