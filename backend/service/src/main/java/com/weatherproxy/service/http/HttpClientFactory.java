package com.weatherproxy.service.http;

import java.net.http.HttpClient;
import java.time.Duration;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    /**
     * Builds the client shared by all upstream calls. Redirects are followed so a moved
     * forecast resource still resolves in a single logical call.
     */
    public static HttpClient create(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }
}
