package com.weatherproxy.service.config;

import java.time.Duration;

public record ServiceConfig(
        Integer port,
        String nwsBaseUrl,
        String userAgent,
        Duration connectTimeout,
        Duration requestTimeout
) {
    public static final int DEFAULT_PORT = 8080;
    public static final String DEFAULT_NWS_BASE_URL = "https://api.weather.gov";
    public static final String DEFAULT_USER_AGENT = "weather-proxy/1.0 (contact: support@example.com)";
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(10);

    public static ServiceConfig defaults() {
        return new ServiceConfig(null, null, null, null, null).withDefaults();
    }

    public ServiceConfig withDefaults() {
        return new ServiceConfig(
                port == null ? DEFAULT_PORT : port,
                isBlank(nwsBaseUrl) ? DEFAULT_NWS_BASE_URL : stripTrailingSlash(nwsBaseUrl),
                isBlank(userAgent) ? DEFAULT_USER_AGENT : userAgent,
                connectTimeout == null ? DEFAULT_CONNECT_TIMEOUT : connectTimeout,
                requestTimeout == null ? DEFAULT_REQUEST_TIMEOUT : requestTimeout
        );
    }

    public ServiceConfig withPort(int newPort) {
        return new ServiceConfig(newPort, nwsBaseUrl, userAgent, connectTimeout, requestTimeout);
    }

    public ServiceConfig withNwsBaseUrl(String newBaseUrl) {
        return new ServiceConfig(port, stripTrailingSlash(newBaseUrl), userAgent, connectTimeout, requestTimeout);
    }

    public ServiceConfig withUserAgent(String newUserAgent) {
        return new ServiceConfig(port, nwsBaseUrl, newUserAgent, connectTimeout, requestTimeout);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
