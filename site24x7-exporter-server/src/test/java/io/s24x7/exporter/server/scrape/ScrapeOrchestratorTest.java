package io.s24x7.exporter.server.scrape;

import io.s24x7.exporter.client.ClientSettings;
import io.s24x7.exporter.client.Site24x7Client;
import io.s24x7.exporter.client.auth.Credentials;
import io.s24x7.exporter.client.auth.TokenManager;
import io.s24x7.exporter.server.metrics.ExporterMetrics;
import io.s24x7.exporter.server.metrics.MonitorMetricsRegistry;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScrapeOrchestrator against a fake Site24x7 and Zoho accounts host.
 */
class ScrapeOrchestratorTest {

    private MockWebServer server;
    private FakeSite24x7 site24x7;
    private TokenManager tokenManager;
    private MonitorMetricsRegistry registry;
    private ExporterMetrics metrics;
    private ScrapeOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        site24x7 = new FakeSite24x7();
        server = new MockWebServer();
        server.setDispatcher(site24x7);
        server.start();
        orchestrator = newOrchestrator(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        orchestrator.close();
        server.shutdown();
    }

    private ScrapeOrchestrator newOrchestrator(Duration fetchTimeout) {
        return newOrchestrator(fetchTimeout, new MonitorMetricsRegistry());
    }

    private ScrapeOrchestrator newOrchestrator(Duration fetchTimeout, MonitorMetricsRegistry metricsRegistry) {
        ClientSettings settings = ClientSettings.builder()
                .apiUrl(server.url("/api").toString())
                .accountsUrl(server.url("/").toString())
                .requestTimeout(Duration.ofSeconds(3))
                .tokenMaxRetries(0)
                .build();
        HttpClient httpClient = HttpClient.newHttpClient();
        registry = metricsRegistry;
        metrics = new ExporterMetrics(registry.getMeterRegistry());
        tokenManager = new TokenManager(httpClient, settings, new Credentials("id", "secret", "refresh"),
                Clock.systemUTC(), metrics);
        return new ScrapeOrchestrator(tokenManager, new Site24x7Client(httpClient, settings), registry, metrics,
                fetchTimeout);
    }

    @Test
    @DisplayName("Should publish fetched monitors with their groups")
    void successfulScrape() {
        ScrapeResult result = orchestrator.scrape();

        assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
        assertEquals(2, result.monitors());
        assertEquals(Set.of("m1", "m2"), registry.trackedMonitorIds());
        assertTrue(metrics.isLastScrapeSuccessful());

        String text = orchestrator.scrapeAndRender();
        assertTrue(text.contains("monitor_group=\"Web\""));
        assertTrue(text.contains("site24x7_exporter_last_scrape_success 1.0"));
    }

    @Test
    @DisplayName("Should renew a rejected token once and retry only the rejected fetch")
    void renewRejectedToken() {
        tokenManager.getValidToken();
        assertEquals(1, site24x7.tokenExchanges.get());
        site24x7.rejectedToken = "token-1";

        ScrapeResult result = orchestrator.scrape();

        assertTrue(result.isSuccess(), () -> String.valueOf(result.error()));
        assertEquals(2, site24x7.tokenExchanges.get());
        assertEquals(2, site24x7.currentStatusRequests.get());
        assertEquals(1, site24x7.groupRequests.get());
        assertEquals(Set.of("m1", "m2"), registry.trackedMonitorIds());
    }

    @Test
    @DisplayName("Should keep the previous snapshot when the token is rejected twice")
    void rejectedTwice() {
        assertTrue(orchestrator.scrape().isSuccess());
        site24x7.rejectAllTokens = true;
        site24x7.monitorIds = new String[]{"m3"};

        ScrapeResult result = orchestrator.scrape();

        assertFalse(result.isSuccess());
        assertEquals(ScrapeStage.FETCH, result.failedStage());
        assertEquals(Set.of("m1", "m2"), registry.trackedMonitorIds());
        assertFalse(metrics.isLastScrapeSuccessful());
        assertEquals(1, metrics.scrapeErrorCount(ScrapeStage.FETCH));

        String text = registry.scrape();
        assertTrue(text.contains("site24x7_exporter_last_scrape_success 0.0"));
        assertTrue(text.contains("site24x7_exporter_scrape_errors_total{stage=\"fetch\"} 1.0"));
        assertTrue(text.contains("monitor_id=\"m1\""));
    }

    @Test
    @DisplayName("Should not apply a partial update when one fetch fails")
    void noPartialUpdate() {
        assertTrue(orchestrator.scrape().isSuccess());
        site24x7.groupsStatus = 500;
        site24x7.monitorIds = new String[]{"m3"};

        ScrapeResult result = orchestrator.scrape();

        assertEquals(ScrapeStage.FETCH, result.failedStage());
        assertEquals(Set.of("m1", "m2"), registry.trackedMonitorIds());
        assertEquals(1, tokenManager.getExchangeCount());
    }

    @Test
    @DisplayName("Should fail at token stage when credentials are rejected")
    void rejectedCredentials() {
        site24x7.rejectCredentials = true;

        ScrapeResult result = orchestrator.scrape();

        assertEquals(ScrapeStage.REQUEST_TOKEN, result.failedStage());
        assertEquals(0, site24x7.currentStatusRequests.get());
        assertEquals(1, metrics.scrapeErrorCount(ScrapeStage.REQUEST_TOKEN));
        assertTrue(registry.scrape().contains("site24x7_exporter_token_exchanges_total{outcome=\"failure\"} 1.0"));
    }

    @Test
    @DisplayName("Should fail the scrape when a fetch exceeds the scrape timeout")
    void fetchTimeout() {
        orchestrator.close();
        orchestrator = newOrchestrator(Duration.ofMillis(200));
        site24x7.apiDelayMillis = 1000;

        ScrapeResult result = orchestrator.scrape();

        assertEquals(ScrapeStage.FETCH, result.failedStage());
        assertTrue(registry.trackedMonitorIds().isEmpty());
    }

    @Test
    @DisplayName("Should bound both fetches by one scrape deadline")
    void sharedFetchDeadline() {
        orchestrator.close();
        orchestrator = newOrchestrator(Duration.ofMillis(600));
        site24x7.groupsDelayMillis = 400;
        site24x7.currentStatusDelayMillis = 900;

        ScrapeResult result = orchestrator.scrape();

        assertEquals(ScrapeStage.FETCH, result.failedStage());
        assertTrue(result.duration().compareTo(Duration.ofMillis(900)) < 0, () -> "took " + result.duration());
        assertTrue(registry.trackedMonitorIds().isEmpty());
    }

    @Test
    @DisplayName("Should count a snapshot that can't be rendered under the publish stage")
    void publishFailure() {
        orchestrator.close();
        orchestrator = newOrchestrator(Duration.ofSeconds(5), new MonitorMetricsRegistry() {
            @Override
            public String scrape() {
                throw new IllegalStateException("exposition failed");
            }
        });

        IllegalStateException e = assertThrows(IllegalStateException.class, orchestrator::scrapeAndRender);

        assertEquals("exposition failed", e.getMessage());
        assertEquals(1, metrics.scrapeErrorCount(ScrapeStage.PUBLISH_SNAPSHOT));
        assertEquals(0, metrics.scrapeErrorCount(ScrapeStage.FETCH));
        assertFalse(metrics.isLastScrapeSuccessful());
    }

    @Test
    @DisplayName("Should share the running scrape with overlapping requests")
    void coalesceOverlappingScrapes() throws Exception {
        site24x7.apiDelayMillis = 500;

        CompletableFuture<ScrapeResult> first = CompletableFuture.supplyAsync(orchestrator::scrape);
        assertTrue(site24x7.currentStatusStarted.await(5, TimeUnit.SECONDS));
        ScrapeResult second = orchestrator.scrape();

        assertSame(first.get(5, TimeUnit.SECONDS), second);
        assertEquals(1, site24x7.currentStatusRequests.get());
    }

    @Test
    @DisplayName("Should count undecodable monitors")
    void decodeErrors() {
        site24x7.brokenMonitor = true;

        assertTrue(orchestrator.scrape().isSuccess());

        assertTrue(registry.scrape().contains("site24x7_exporter_decode_errors_total 1.0"));
        assertTrue(registry.trackedMonitorIds().contains("broken"));
    }

    private static class FakeSite24x7 extends Dispatcher {
        final AtomicInteger tokenExchanges = new AtomicInteger();
        final AtomicInteger currentStatusRequests = new AtomicInteger();
        final AtomicInteger groupRequests = new AtomicInteger();
        final CountDownLatch currentStatusStarted = new CountDownLatch(1);

        volatile boolean rejectCredentials;
        volatile boolean rejectAllTokens;
        volatile boolean brokenMonitor;
        volatile String rejectedToken;
        volatile int groupsStatus = 200;
        volatile long apiDelayMillis;
        volatile long groupsDelayMillis;
        volatile long currentStatusDelayMillis;
        volatile String[] monitorIds = {"m1", "m2"};

        @Override
        public MockResponse dispatch(RecordedRequest request) {
            String path = request.getPath() == null ? "" : request.getPath();
            if (path.startsWith("/oauth/v2/token")) {
                int n = tokenExchanges.incrementAndGet();
                if (rejectCredentials) {
                    return json("{\"error\": \"invalid_code\"}");
                }
                return json("{\"access_token\": \"token-" + n + "\", \"expires_in\": 3600}");
            }

            String authorization = request.getHeader("Authorization");

            if (path.startsWith("/api/current_status")) {
                currentStatusRequests.incrementAndGet();
                currentStatusStarted.countDown();
                if (rejectAllTokens || (rejectedToken != null && ("Zoho-oauthtoken " + rejectedToken).equals(authorization))) {
                    return json("{\"error_code\": 1010, \"message\": \"OAuth Access Token is invalid or has expired.\"}");
                }
                return delayed(json(currentStatus()), currentStatusDelayMillis);
            }
            if (path.startsWith("/api/monitor_groups")) {
                groupRequests.incrementAndGet();
                if (rejectAllTokens) {
                    return new MockResponse().setResponseCode(401);
                }
                if (groupsStatus != 200) {
                    return new MockResponse().setResponseCode(groupsStatus).setBody("{\"code\": 500, \"message\": \"boom\"}");
                }
                return delayed(json("""
                        {"code": 0, "data": [{"group_id": "g1", "display_name": "Web", "monitors": ["m1"]}]}
                        """), groupsDelayMillis);
            }
            return new MockResponse().setResponseCode(404);
        }

        private String currentStatus() {
            StringBuilder monitors = new StringBuilder();
            for (String id : monitorIds) {
                if (monitors.length() > 0) {
                    monitors.append(',');
                }
                monitors.append("{\"monitor_id\": \"").append(id).append("\", \"name\": \"Monitor ").append(id)
                        .append("\", \"monitor_type\": \"URL\", \"status\": 1, \"attribute_value\": 100}");
            }
            if (brokenMonitor) {
                monitors.append(",{\"monitor_id\": \"broken\", \"name\": \"Broken\", \"monitor_type\": \"URL\", \"status\": \"?\"}");
            }
            return "{\"code\": 0, \"data\": {\"monitors\": [" + monitors + "]}}";
        }

        private MockResponse delayed(MockResponse response, long extraMillis) {
            long delay = apiDelayMillis + extraMillis;
            return delay > 0 ? response.setHeadersDelay(delay, TimeUnit.MILLISECONDS) : response;
        }

        private static MockResponse json(String body) {
            return new MockResponse()
                    .setResponseCode(200)
                    .setHeader("Content-Type", "application/json")
                    .setBody(body);
        }
    }
}
