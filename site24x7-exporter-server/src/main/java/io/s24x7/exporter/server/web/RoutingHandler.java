package io.s24x7.exporter.server.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Dispatches on the exact request path. GET requests to the telemetry and geolocation paths
 * go to their handlers, everything else gets a short pointer to the telemetry path.
 */
class RoutingHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(RoutingHandler.class);

    private final String telemetryPath;
    private final String geolocationPath;
    private final HttpHandler metricsHandler;
    private final HttpHandler geolocationHandler;

    RoutingHandler(String telemetryPath, String geolocationPath,
                   HttpHandler metricsHandler, HttpHandler geolocationHandler) {
        this.telemetryPath = telemetryPath;
        this.geolocationPath = geolocationPath;
        this.metricsHandler = metricsHandler;
        this.geolocationHandler = geolocationHandler;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        try {
            String method = exchange.getRequestMethod();
            String path = exchange.getRequestURI().getPath();
            boolean get = "GET".equalsIgnoreCase(method) || "HEAD".equalsIgnoreCase(method);

            if (get && geolocationPath.equals(path)) {
                geolocationHandler.handle(exchange);
            } else if (get && telemetryPath.equals(path)) {
                metricsHandler.handle(exchange);
            } else {
                log.info("Serving default path");
                HttpResponses.sendText(exchange, 200, "site24x7_exporter\n\nTry " + telemetryPath);
            }
        } finally {
            exchange.close();
        }
    }
}
