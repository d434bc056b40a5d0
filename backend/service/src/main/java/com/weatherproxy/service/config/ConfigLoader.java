package com.weatherproxy.service.config;

import com.weatherproxy.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;
import java.util.logging.Logger;

public final class ConfigLoader {
    private static final Logger LOGGER = Logger.getLogger(ConfigLoader.class.getName());

    private ConfigLoader() {
    }

    public static ServiceConfig load(Path configFile, Map<String, String> env) {
        return load(configFile, env, LOGGER::warning);
    }

    static ServiceConfig load(Path configFile, Map<String, String> env, Consumer<String> warn) {
        ServiceConfig fromFile = Files.exists(configFile) ? read(configFile) : ServiceConfig.defaults();
        return applyEnvironment(fromFile.withDefaults(), env, warn);
    }

    static ServiceConfig applyEnvironment(ServiceConfig config, Map<String, String> env, Consumer<String> warn) {
        ServiceConfig effective = config;

        String portRaw = env.get("PORT");
        if (portRaw != null && !portRaw.isBlank()) {
            try {
                int port = Integer.parseInt(portRaw.trim());
                if (!isValidPort(port)) {
                    throw new NumberFormatException("out of range");
                }
                effective = effective.withPort(port);
            } catch (NumberFormatException e) {
                warn.accept("Ignoring invalid PORT=" + portRaw + ", using " + effective.port());
            }
        }

        String baseUrl = env.get("NWS_BASE_URL");
        if (baseUrl != null && !baseUrl.isBlank()) {
            effective = effective.withNwsBaseUrl(baseUrl);
        }

        String userAgent = env.get("NWS_USER_AGENT");
        if (userAgent != null && !userAgent.isBlank()) {
            effective = effective.withUserAgent(userAgent);
        }
        return effective;
    }

    private static boolean isValidPort(int port) {
        return port >= 0 && port <= 65535;
    }

    private static ServiceConfig read(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            ServiceConfig config = JsonUtils.objectMapper().readValue(in, ServiceConfig.class);
            if (config == null) {
                throw new IllegalStateException("Empty config file " + path);
            }
            if (config.port() != null && !isValidPort(config.port())) {
                throw new IllegalStateException("Invalid port " + config.port() + " in config " + path);
            }
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
