package io.s24x7.exporter.client.auth;

import io.s24x7.exporter.client.AuthException;
import io.s24x7.exporter.client.ClientSettings;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TokenManager - token caching, renewal and single-flight refresh.
 */
class TokenManagerTest {

    private MockWebServer accountsServer;
    private MutableClock clock;
    private ClientSettings settings;
    private Credentials credentials;

    @BeforeEach
    void setUp() throws Exception {
        accountsServer = new MockWebServer();
        accountsServer.start();

        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        settings = ClientSettings.builder()
                .apiUrl("http://unused.invalid/api")
                .accountsUrl(accountsServer.url("/").toString())
                .requestTimeout(Duration.ofSeconds(2))
                .tokenExpirySafetyMargin(Duration.ofSeconds(60))
                .tokenMaxRetries(2)
                .tokenRetryDelay(Duration.ofMillis(10))
                .build();
        credentials = new Credentials("client-1", "s3cr3t&=", "refresh-abc");
    }

    @AfterEach
    void tearDown() throws Exception {
        accountsServer.shutdown();
    }

    private TokenManager newTokenManager() {
        return new TokenManager(HttpClient.newHttpClient(), settings, credentials, clock, TokenListener.NOOP);
    }

    private static MockResponse tokenResponse(String token, long expiresIn) {
        return new MockResponse()
                .setResponseCode(200)
                .setHeader("Content-Type", "application/json")
                .setBody("""
                        {"access_token": "%s", "expires_in": %d, "api_domain": "https://www.zohoapis.com", "token_type": "Bearer"}
                        """.formatted(token, expiresIn));
    }

    @Test
    @DisplayName("Should post form-encoded credentials to the token endpoint")
    void exchangeRequestFormat() throws Exception {
        accountsServer.enqueue(tokenResponse("token-1", 3600));

        AccessToken token = newTokenManager().getValidToken();

        assertEquals("token-1", token.value());
        assertEquals(Instant.parse("2024-03-01T11:00:00Z"), token.expiresAt());

        RecordedRequest request = accountsServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/oauth/v2/token", request.getPath());
        assertTrue(request.getHeader("Content-Type").startsWith("application/x-www-form-urlencoded"));
        assertEquals("client_id=client-1&client_secret=s3cr3t%26%3D&refresh_token=refresh-abc&grant_type=refresh_token",
                request.getBody().readUtf8());
    }

    @Test
    @DisplayName("Should reuse cached token while it is outside the safety margin")
    void reuseCachedToken() {
        accountsServer.enqueue(tokenResponse("token-1", 3600));
        TokenManager manager = newTokenManager();

        AccessToken first = manager.getValidToken();
        clock.advanceBy(Duration.ofMinutes(30));
        AccessToken second = manager.getValidToken();

        assertSame(first, second);
        assertEquals(1, accountsServer.getRequestCount());
        assertEquals(1, manager.getExchangeCount());
    }

    @Test
    @DisplayName("Should renew token once it enters the safety margin")
    void renewNearExpiry() {
        accountsServer.enqueue(tokenResponse("token-1", 3600));
        accountsServer.enqueue(tokenResponse("token-2", 3600));
        TokenManager manager = newTokenManager();

        assertEquals("token-1", manager.getValidToken().value());
        clock.advanceBy(Duration.ofSeconds(3600 - 30));
        assertEquals("token-2", manager.getValidToken().value());
        assertEquals(2, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should renew token after it was invalidated")
    void renewAfterInvalidate() {
        accountsServer.enqueue(tokenResponse("token-1", 3600));
        accountsServer.enqueue(tokenResponse("token-2", 3600));
        TokenManager manager = newTokenManager();

        AccessToken first = manager.getValidToken();
        manager.invalidate(first);

        assertEquals("token-2", manager.getValidToken().value());
        assertEquals(2, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should ignore invalidation of a token that was already replaced")
    void ignoreStaleInvalidate() {
        accountsServer.enqueue(tokenResponse("token-1", 3600));
        accountsServer.enqueue(tokenResponse("token-2", 3600));
        TokenManager manager = newTokenManager();

        AccessToken first = manager.getValidToken();
        manager.invalidate(first);
        AccessToken second = manager.getValidToken();
        manager.invalidate(first);

        assertSame(second, manager.getValidToken());
        assertEquals(2, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should issue a single exchange for concurrent callers")
    void singleFlightRefresh() throws Exception {
        accountsServer.enqueue(tokenResponse("token-1", 3600).setBodyDelay(300, TimeUnit.MILLISECONDS));
        accountsServer.enqueue(tokenResponse("token-unexpected", 3600));
        TokenManager manager = newTokenManager();

        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<AccessToken>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return manager.getValidToken();
                }));
            }
            start.countDown();
            for (Future<AccessToken> result : results) {
                assertEquals("token-1", result.get(5, TimeUnit.SECONDS).value());
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should fail without retry when credentials are rejected")
    void rejectedCredentials() {
        accountsServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"error\": \"invalid_client\"}"));
        AtomicInteger failures = new AtomicInteger();
        TokenManager manager = new TokenManager(HttpClient.newHttpClient(), settings, credentials, clock,
                new TokenListener() {
                    @Override
                    public void onExchangeFailed(Throwable error) {
                        failures.incrementAndGet();
                    }
                });

        AuthException e = assertThrows(AuthException.class, manager::getValidToken);

        assertEquals(AuthException.Reason.REJECTED_CREDENTIALS, e.getReason());
        assertTrue(e.getMessage().contains("invalid_client"));
        assertFalse(e.getMessage().contains("s3cr3t"));
        assertFalse(e.getMessage().contains("refresh-abc"));
        assertEquals(1, accountsServer.getRequestCount());
        assertEquals(1, failures.get());
    }

    @Test
    @DisplayName("Should retry server errors and succeed within the budget")
    void retryServerErrors() {
        accountsServer.enqueue(new MockResponse().setResponseCode(503));
        accountsServer.enqueue(tokenResponse("token-1", 3600));

        assertEquals("token-1", newTokenManager().getValidToken().value());
        assertEquals(2, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should give up after the retry budget is exhausted")
    void exhaustRetries() {
        for (int i = 0; i < 3; i++) {
            accountsServer.enqueue(new MockResponse().setResponseCode(502));
        }

        AuthException e = assertThrows(AuthException.class, newTokenManager()::getValidToken);

        assertEquals(AuthException.Reason.EXCHANGE_FAILED, e.getReason());
        assertEquals(3, accountsServer.getRequestCount());
    }

    @Test
    @DisplayName("Should default expiry when expires_in is missing")
    void defaultExpiry() {
        accountsServer.enqueue(new MockResponse().setResponseCode(200).setBody("{\"access_token\": \"token-1\"}"));

        AccessToken token = newTokenManager().getValidToken();

        assertEquals(clock.instant().plusSeconds(TokenManager.DEFAULT_EXPIRES_IN_SECONDS), token.expiresAt());
    }

    @Test
    @DisplayName("Should not expose secrets in toString")
    void redactedToString() {
        AccessToken token = new AccessToken("very-secret-token", Instant.EPOCH);

        assertFalse(token.toString().contains("very-secret-token"));
        assertFalse(credentials.toString().contains("s3cr3t"));
        assertFalse(credentials.toString().contains("refresh-abc"));
        assertTrue(credentials.toString().contains("client-1"));
    }
}
