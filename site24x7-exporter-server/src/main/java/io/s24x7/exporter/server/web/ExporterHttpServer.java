package io.s24x7.exporter.server.web;

import com.sun.net.httpserver.HttpServer;
import io.s24x7.exporter.server.scrape.ScrapeOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP listener serving the telemetry, geolocation and index endpoints.
 */
public class ExporterHttpServer {

    private static final Logger log = LoggerFactory.getLogger(ExporterHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;

    public ExporterHttpServer(String host, int port, String telemetryPath, String geolocationPath,
                              ScrapeOrchestrator orchestrator, GeoLocationTable geoLocations) throws IOException {
        server = HttpServer.create(new InetSocketAddress(host, port), 0);
        server.createContext("/", new RoutingHandler(telemetryPath, geolocationPath,
                new MetricsHandler(orchestrator), new GeolocationHandler(geoLocations)));
        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "site24x7-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Listening on {}", server.getAddress());
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    public void stop(int delaySeconds) {
        server.stop(delaySeconds);
        executor.shutdownNow();
    }
}
