package io.s24x7.exporter.server.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Serves the location table as JSON, readable from any origin (dashboards load it directly).
 */
class GeolocationHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(GeolocationHandler.class);

    private final GeoLocationTable table;

    GeolocationHandler(GeoLocationTable table) {
        this.table = table;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        log.info("Serving geolocation info");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        HttpResponses.send(exchange, 200, "application/json", table.toJson());
    }
}
