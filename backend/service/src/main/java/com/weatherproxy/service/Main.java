package com.weatherproxy.service;

import com.weatherproxy.service.api.ApiServer;
import com.weatherproxy.service.api.WeatherRequestHandler;
import com.weatherproxy.service.config.ConfigLoader;
import com.weatherproxy.service.config.ServiceConfig;
import com.weatherproxy.service.http.HttpClientFactory;
import com.weatherproxy.service.nws.NwsForecastClient;

import java.net.http.HttpClient;
import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        Path configFile = Path.of(args.length > 0 ? args[0] : "config/service.json");
        ServiceConfig config = ConfigLoader.load(configFile, System.getenv());
        LOGGER.info("Using NWS API at " + config.nwsBaseUrl() + " with request timeout " + config.requestTimeout());

        ApiServer apiServer = createServer(config);
        apiServer.start();

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            apiServer.stop();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
    }

    static ApiServer createServer(ServiceConfig config) {
        HttpClient httpClient = HttpClientFactory.create(config.connectTimeout());
        NwsForecastClient forecastClient = new NwsForecastClient(
                httpClient,
                config.nwsBaseUrl(),
                config.requestTimeout(),
                config.userAgent()
        );
        return new ApiServer(config.port(), new WeatherRequestHandler(forecastClient));
    }
}
