package io.s24x7.exporter.server.scrape;

import io.s24x7.exporter.client.AuthException;
import io.s24x7.exporter.client.FetchException;
import io.s24x7.exporter.client.Site24x7Client;
import io.s24x7.exporter.client.Site24x7Exception;
import io.s24x7.exporter.client.auth.AccessToken;
import io.s24x7.exporter.client.auth.TokenManager;
import io.s24x7.exporter.client.model.Monitor;
import io.s24x7.exporter.client.model.MonitorGroup;
import io.s24x7.exporter.server.metrics.ExporterMetrics;
import io.s24x7.exporter.server.metrics.MonitorMetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Runs one scrape per inbound metrics request: token, fetch, registry update.
 *
 * Groups and monitors are fetched concurrently. The whole fetch stage, including a retry
 * after a token renewal, shares one deadline of {@code fetchTimeout}. A token rejected during
 * the fetch is invalidated and renewed once, and only the rejected fetches are repeated. The registry is
 * only updated when both listings arrived, otherwise it keeps the previous snapshot.
 * Requests that arrive while a scrape is running share its result.
 */
public class ScrapeOrchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScrapeOrchestrator.class);

    private final TokenManager tokenManager;
    private final Site24x7Client client;
    private final MonitorMetricsRegistry registry;
    private final ExporterMetrics metrics;
    private final Duration fetchTimeout;
    private final ExecutorService fetchExecutor;
    private final AtomicReference<CompletableFuture<ScrapeResult>> inFlight = new AtomicReference<>();

    public ScrapeOrchestrator(TokenManager tokenManager, Site24x7Client client, MonitorMetricsRegistry registry,
                              ExporterMetrics metrics, Duration fetchTimeout) {
        this.tokenManager = tokenManager;
        this.client = client;
        this.registry = registry;
        this.metrics = metrics;
        this.fetchTimeout = fetchTimeout;
        AtomicInteger threadCount = new AtomicInteger();
        this.fetchExecutor = Executors.newFixedThreadPool(2, r -> {
            Thread t = new Thread(r, "site24x7-fetch-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run a scrape, or wait for the one already running.
     */
    public ScrapeResult scrape() {
        CompletableFuture<ScrapeResult> mine = new CompletableFuture<>();
        CompletableFuture<ScrapeResult> running = inFlight.compareAndExchange(null, mine);
        if (running != null) {
            log.debug("Scrape already in progress, waiting for its result");
            return running.join();
        }
        try {
            ScrapeResult result = runPipeline();
            mine.complete(result);
            return result;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.compareAndSet(mine, null);
        }
    }

    /**
     * Run a scrape and render the snapshot. A failed scrape renders the previous snapshot.
     * A rendering failure is counted under {@link ScrapeStage#PUBLISH_SNAPSHOT} and rethrown.
     */
    public String scrapeAndRender() {
        scrape();
        long start = System.nanoTime();
        try {
            return registry.scrape();
        } catch (RuntimeException e) {
            fail(ScrapeStage.PUBLISH_SNAPSHOT, e, start);
            throw e;
        }
    }

    private ScrapeResult runPipeline() {
        long start = System.nanoTime();

        AccessToken token;
        try {
            token = tokenManager.getValidToken();
        } catch (AuthException e) {
            return fail(ScrapeStage.REQUEST_TOKEN, e, start);
        }

        List<MonitorGroup> groups = null;
        List<Monitor> monitors = null;
        Future<List<MonitorGroup>> groupsFetch = submit(client::listMonitorGroups, token);
        Future<List<Monitor>> monitorsFetch = submit(client::listMonitors, token);
        long deadline = System.nanoTime() + fetchTimeout.toNanos();
        try {
            AuthException rejected = null;
            try {
                groups = await(groupsFetch, "monitor groups", deadline);
            } catch (AuthException e) {
                rejected = e;
            }
            try {
                monitors = await(monitorsFetch, "monitors", deadline);
            } catch (AuthException e) {
                rejected = e;
            }

            if (rejected != null) {
                log.info("Access token was rejected ({}), renewing it and retrying", rejected.getMessage());
                tokenManager.invalidate(token);
                AccessToken renewed;
                try {
                    renewed = tokenManager.getValidToken();
                } catch (AuthException e) {
                    return fail(ScrapeStage.REQUEST_TOKEN, e, start);
                }
                if (groups == null) {
                    groupsFetch = submit(client::listMonitorGroups, renewed);
                }
                if (monitors == null) {
                    monitorsFetch = submit(client::listMonitors, renewed);
                }
                if (groups == null) {
                    groups = await(groupsFetch, "monitor groups", deadline);
                }
                if (monitors == null) {
                    monitors = await(monitorsFetch, "monitors", deadline);
                }
            }
        } catch (Site24x7Exception e) {
            groupsFetch.cancel(true);
            monitorsFetch.cancel(true);
            return fail(ScrapeStage.FETCH, e, start);
        }

        try {
            int undecodable = (int) monitors.stream().filter(m -> !m.decoded()).count();
            metrics.recordDecodeErrors(undecodable);
            registry.update(monitors, groups);
        } catch (RuntimeException e) {
            log.error("Couldn't update metrics registry", e);
            return fail(ScrapeStage.UPDATE_REGISTRY, e, start);
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordScrapeSuccess(duration);
        log.debug("Scrape finished in {}ms: {} monitors, {} groups", duration.toMillis(), monitors.size(), groups.size());
        return ScrapeResult.success(monitors.size(), duration);
    }

    private <T> Future<T> submit(Function<AccessToken, T> fetch, AccessToken token) {
        return fetchExecutor.submit(() -> fetch.apply(token));
    }

    private <T> T await(Future<T> fetch, String what, long deadline) {
        try {
            return fetch.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            fetch.cancel(true);
            throw new FetchException("Fetching " + what + " took longer than " + fetchTimeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fetch.cancel(true);
            throw new FetchException("Interrupted while fetching " + what, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof Site24x7Exception site24x7Exception) {
                throw site24x7Exception;
            }
            throw new FetchException("Unexpected error while fetching " + what, e.getCause());
        }
    }

    private ScrapeResult fail(ScrapeStage stage, Exception error, long start) {
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        log.warn("Scrape failed at stage {}: {}", stage.label(), error.getMessage());
        metrics.recordScrapeFailure(stage, duration);
        return ScrapeResult.failure(stage, error.getMessage(), duration);
    }

    @Override
    public void close() {
        fetchExecutor.shutdownNow();
    }
}
