package io.s24x7.exporter.server.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import io.s24x7.exporter.server.scrape.ScrapeOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Serves the metric snapshot. Every request triggers a scrape; a failed scrape still
 * answers 200 with the previous snapshot and the scrape error metrics.
 */
class MetricsHandler implements HttpHandler {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final ScrapeOrchestrator orchestrator;

    MetricsHandler(ScrapeOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void handle(HttpExchange exchange) throws IOException {
        log.info("Serving metrics");
        String body;
        try {
            body = orchestrator.scrapeAndRender();
        } catch (RuntimeException e) {
            log.error("Couldn't render metrics", e);
            HttpResponses.sendText(exchange, 500, "Couldn't render metrics: " + e.getMessage() + "\n");
            return;
        }
        HttpResponses.send(exchange, 200, CONTENT_TYPE, body.getBytes(StandardCharsets.UTF_8));
    }
}
