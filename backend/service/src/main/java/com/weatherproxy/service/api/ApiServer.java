package com.weatherproxy.service.api;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.weatherproxy.core.util.JsonUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

public class ApiServer {
    private static final Logger LOGGER = Logger.getLogger(ApiServer.class.getName());
    static final String HEALTH_MESSAGE = "Weather service is running";

    private final int port;
    private final WeatherRequestHandler weatherHandler;

    private HttpServer server;
    private ExecutorService executor;

    public ApiServer(int port, WeatherRequestHandler weatherHandler) {
        this.port = port;
        this.weatherHandler = weatherHandler;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            executor = Executors.newCachedThreadPool();
            server.setExecutor(executor);
            server.createContext("/weather", this::handleWeather);
            server.createContext("/health", this::handleHealth);
            server.createContext("/", this::handleRoot);
            server.start();
            LOGGER.info("Starting weather service on :" + actualPort());
        } catch (IOException e) {
            throw new IllegalStateException("Failed starting API server on port " + port, e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    public int actualPort() {
        if (server == null) {
            return port;
        }
        return server.getAddress().getPort();
    }

    private void handleWeather(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "/weather")) {
            return;
        }
        Map<String, String> query = queryParams(exchange.getRequestURI());
        WeatherRequestHandler.HandlerResponse response = weatherHandler.handle(query);
        writeJson(exchange, response.status(), response.body());
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "/health")) {
            return;
        }
        write(exchange, 200, "text/plain; charset=utf-8", HEALTH_MESSAGE.getBytes(StandardCharsets.UTF_8));
    }

    private void handleRoot(HttpExchange exchange) throws IOException {
        if (!ensureRoute(exchange, "/")) {
            return;
        }
        write(exchange, 200, "text/html; charset=utf-8", UsagePage.html().getBytes(StandardCharsets.UTF_8));
    }

    // Contexts match by prefix, so anything but the exact path is a 404; only GET is routed.
    private boolean ensureRoute(HttpExchange exchange, String path) throws IOException {
        if (!path.equals(exchange.getRequestURI().getPath())) {
            write(exchange, 404, "text/plain; charset=utf-8", "404 page not found".getBytes(StandardCharsets.UTF_8));
            return false;
        }
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return false;
        }
        return true;
    }

    private void writeJson(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] payload = JsonUtils.objectMapper().writeValueAsBytes(body);
        write(exchange, status, "application/json", payload);
    }

    private void write(HttpExchange exchange, int status, String contentType, byte[] payload) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(payload);
        }
    }

    private Map<String, String> queryParams(URI uri) {
        Map<String, String> query = new HashMap<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isBlank()) {
            return query;
        }
        for (String entry : raw.split("&")) {
            String[] pair = entry.split("=", 2);
            String key = URLDecoder.decode(pair[0], StandardCharsets.UTF_8);
            String value = pair.length > 1 ? URLDecoder.decode(pair[1], StandardCharsets.UTF_8) : "";
            // first occurrence wins
            query.putIfAbsent(key, value);
        }
        return query;
    }
}
