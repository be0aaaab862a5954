package io.s24x7.exporter.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.s24x7.exporter.client.AuthException;
import io.s24x7.exporter.client.ClientSettings;
import io.s24x7.exporter.client.ProxySettings;
import io.s24x7.exporter.client.Site24x7Client;
import io.s24x7.exporter.client.auth.TokenManager;
import io.s24x7.exporter.server.config.ExporterConfig;
import io.s24x7.exporter.server.config.InvalidConfigurationException;
import io.s24x7.exporter.server.metrics.ExporterMetrics;
import io.s24x7.exporter.server.metrics.MonitorMetricsRegistry;
import io.s24x7.exporter.server.scrape.ScrapeOrchestrator;
import io.s24x7.exporter.server.web.ExporterHttpServer;
import io.s24x7.exporter.server.web.GeoLocationTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires the exporter together and owns its lifecycle.
 *
 * {@link #start()} checks the credentials with one token exchange before the listener is
 * bound: rejected credentials are fatal, a network failure is only logged and the exchange
 * is repeated by the first scrape.
 */
public class ExporterServer {

    private static final Logger log = LoggerFactory.getLogger(ExporterServer.class);

    private final ExporterConfig config;
    private final TokenManager tokenManager;
    private final MonitorMetricsRegistry registry;
    private final ExporterMetrics exporterMetrics;
    private final ScrapeOrchestrator orchestrator;
    private final GeoLocationTable geoLocations;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile ExporterHttpServer httpServer;

    public ExporterServer(ExporterConfig config) {
        this(config, ProxySettings.fromEnvironment());
    }

    public ExporterServer(ExporterConfig config, ProxySettings proxySettings) {
        this.config = config;
        ClientSettings settings = config.toClientSettings();

        proxySettings.logActiveProxies();
        HttpClient httpClient = proxySettings.applyTo(HttpClient.newBuilder()
                        .connectTimeout(settings.getConnectTimeout())
                        .followRedirects(HttpClient.Redirect.NORMAL))
                .build();

        this.registry = new MonitorMetricsRegistry();
        this.exporterMetrics = new ExporterMetrics(registry.getMeterRegistry());
        this.tokenManager = new TokenManager(httpClient, settings, config.getCredentials(),
                Clock.systemUTC(), exporterMetrics);
        Site24x7Client client = new Site24x7Client(httpClient, settings);
        this.orchestrator = new ScrapeOrchestrator(tokenManager, client, registry, exporterMetrics,
                config.getScrapeTimeout());
        this.geoLocations = GeoLocationTable.load(new ObjectMapper());
    }

    /**
     * Check the credentials and start serving. Returns once the listener is bound.
     *
     * @throws InvalidConfigurationException if the accounts host rejects the credentials
     * @throws IOException                   if the listen address can't be bound
     */
    public void start() throws IOException {
        log.info("Starting site24x7 exporter");
        log.info("Configuration: {}", config);
        if (config.isLogSecrets()) {
            log.warn("auth.log-secrets is enabled: client secret, refresh token and access tokens "
                    + "will be written to the logs at DEBUG level");
        }

        try {
            tokenManager.getValidToken();
        } catch (AuthException e) {
            if (e.getReason() == AuthException.Reason.REJECTED_CREDENTIALS) {
                throw new InvalidConfigurationException("Site24x7 credentials were rejected: " + e.getMessage(), e);
            }
            log.warn("Couldn't get an access token at startup, retrying on first scrape: {}", e.getMessage());
        }

        ExporterHttpServer server = new ExporterHttpServer(config.getWebHost(), config.getWebPort(),
                config.getTelemetryPath(), config.getGeolocationPath(), orchestrator, geoLocations);
        server.start();
        httpServer = server;
        log.info("Exporter started, metrics at http://{}:{}{}", config.getWebHost(), server.getPort(),
                config.getTelemetryPath());
    }

    /**
     * Block until {@link #shutdown()} is called.
     */
    public void awaitShutdown() {
        try {
            shutdownLatch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Server interrupted");
        }
    }

    /**
     * Stop the listener and the fetch workers. Safe to call more than once.
     */
    public void shutdown() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down site24x7 exporter...");
        ExporterHttpServer server = httpServer;
        if (server != null) {
            server.stop(0);
        }
        orchestrator.close();
        shutdownLatch.countDown();
        log.info("Exporter stopped");
    }

    /**
     * Port the listener is bound to, or -1 before {@link #start()}.
     */
    public int getPort() {
        ExporterHttpServer server = httpServer;
        return server == null ? -1 : server.getPort();
    }

    MonitorMetricsRegistry getRegistry() {
        return registry;
    }

    ExporterMetrics getExporterMetrics() {
        return exporterMetrics;
    }
}
