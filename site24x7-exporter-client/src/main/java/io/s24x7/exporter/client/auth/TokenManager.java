package io.s24x7.exporter.client.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.s24x7.exporter.client.AuthException;
import io.s24x7.exporter.client.ClientSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Owns the OAuth credentials and the current access token.
 *
 * The cached token is handed out until it is within the safety margin of its expiry, or until
 * the monitoring API rejects it ({@link #invalidate(AccessToken)}). Refreshes are single-flight:
 * while one exchange is in progress every other caller waits for its result instead of
 * issuing its own exchange, since Zoho may rotate tokens on each exchange.
 *
 * @see <a href="https://www.site24x7.com/help/api/#authentication">Site24x7 API authentication</a>
 */
public class TokenManager {

    private static final Logger log = LoggerFactory.getLogger(TokenManager.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final HttpClient httpClient;
    private final ClientSettings settings;
    private final Credentials credentials;
    private final Clock clock;
    private final TokenListener listener;
    private final String tokenEndpoint;

    private final AtomicReference<AccessToken> cached = new AtomicReference<>();
    private final AtomicReference<CompletableFuture<AccessToken>> pendingRefresh = new AtomicReference<>();
    private final AtomicLong exchangeCount = new AtomicLong();

    public TokenManager(HttpClient httpClient, ClientSettings settings, Credentials credentials) {
        this(httpClient, settings, credentials, Clock.systemUTC(), TokenListener.NOOP);
    }

    public TokenManager(HttpClient httpClient, ClientSettings settings, Credentials credentials,
                        Clock clock, TokenListener listener) {
        this.httpClient = httpClient;
        this.settings = settings;
        this.credentials = credentials;
        this.clock = clock;
        this.listener = listener;
        this.tokenEndpoint = settings.getAccountsUrl() + "/oauth/v2/token";
    }

    /**
     * Return a token that is valid for at least the configured safety margin, exchanging the
     * refresh token for a new one if needed.
     *
     * @throws AuthException if the credentials are rejected or the exchange keeps failing
     */
    public AccessToken getValidToken() {
        AccessToken current = cached.get();
        if (current != null && current.isUsableAt(clock.instant(), settings.getTokenExpirySafetyMargin())) {
            return current;
        }
        return refresh(current);
    }

    /**
     * Drop {@code rejected} from the cache so the next {@link #getValidToken()} exchanges.
     * A token that has already been replaced is left alone.
     */
    public void invalidate(AccessToken rejected) {
        if (rejected != null && cached.compareAndSet(rejected, null)) {
            log.info("Access token was rejected by the API, it will be renewed");
        }
    }

    /**
     * Number of token exchange requests sent so far.
     */
    public long getExchangeCount() {
        return exchangeCount.get();
    }

    private AccessToken refresh(AccessToken stale) {
        CompletableFuture<AccessToken> mine = new CompletableFuture<>();
        CompletableFuture<AccessToken> pending = pendingRefresh.compareAndExchange(null, mine);
        if (pending != null) {
            log.debug("Waiting for in-flight token refresh");
            return awaitPending(pending);
        }
        try {
            // a refresh may have completed between the cache read and winning the marker
            AccessToken latest = cached.get();
            if (latest != null && latest != stale
                    && latest.isUsableAt(clock.instant(), settings.getTokenExpirySafetyMargin())) {
                mine.complete(latest);
                return latest;
            }
            AccessToken fresh = exchangeWithRetry();
            cached.set(fresh);
            mine.complete(fresh);
            return fresh;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            pendingRefresh.compareAndSet(mine, null);
        }
    }

    private AccessToken awaitPending(CompletableFuture<AccessToken> pending) {
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthException(AuthException.Reason.EXCHANGE_FAILED,
                    "Interrupted while waiting for access token", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AuthException authException) {
                throw authException;
            }
            throw new AuthException(AuthException.Reason.EXCHANGE_FAILED,
                    "Access token refresh failed", e.getCause());
        }
    }

    private AccessToken exchangeWithRetry() {
        int retries = 0;
        int maxRetries = settings.getTokenMaxRetries();
        long retryDelay = settings.getTokenRetryDelay().toMillis();
        IOException lastError = null;

        while (retries <= maxRetries) {
            try {
                AccessToken token = exchange();
                listener.onExchangeSucceeded();
                return token;
            } catch (IOException e) {
                lastError = e;
                log.warn("Token exchange failed (attempt {}): {}", retries + 1, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                AuthException failure = new AuthException(AuthException.Reason.EXCHANGE_FAILED,
                        "Interrupted while requesting access token", e);
                listener.onExchangeFailed(failure);
                throw failure;
            } catch (AuthException e) {
                listener.onExchangeFailed(e);
                throw e;
            }

            retries++;
            if (retries <= maxRetries) {
                try {
                    Thread.sleep(retryDelay * (long) Math.pow(2, retries - 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        AuthException failure = new AuthException(AuthException.Reason.EXCHANGE_FAILED,
                "Failed to acquire access token after " + retries + " attempts", lastError);
        listener.onExchangeFailed(failure);
        throw failure;
    }

    private AccessToken exchange() throws IOException, InterruptedException {
        log.info("Requesting access token from {}", tokenEndpoint);
        if (settings.isLogSecrets()) {
            log.debug("Token exchange with client_id={}, client_secret={}, refresh_token={}",
                    credentials.clientId(), credentials.clientSecret(), credentials.refreshToken());
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenEndpoint))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .header("Accept", "application/json")
                .timeout(settings.getRequestTimeout())
                .POST(HttpRequest.BodyPublishers.ofString(formBody()))
                .build();

        exchangeCount.incrementAndGet();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();
        if (status >= 500) {
            throw new IOException("Token endpoint returned status " + status);
        }

        JsonNode body;
        try {
            body = MAPPER.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            if (status >= 400) {
                throw new AuthException(AuthException.Reason.REJECTED_CREDENTIALS,
                        "Token endpoint rejected the request with status " + status);
            }
            throw new IOException("Couldn't parse token endpoint response (status " + status + ")", e);
        }

        JsonNode accessToken = body == null ? null : body.get("access_token");
        if (status < 300 && accessToken != null && accessToken.isTextual() && !accessToken.asText().isEmpty()) {
            long expiresIn = body.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
            if (expiresIn <= 0) {
                expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
            }
            AccessToken token = new AccessToken(accessToken.asText(), clock.instant().plus(Duration.ofSeconds(expiresIn)));
            log.info("Successfully acquired access token, valid for {}s", expiresIn);
            if (settings.isLogSecrets()) {
                log.debug("Access token value: {}", token.value());
            }
            return token;
        }

        String error = body == null ? null : body.path("error").asText(null);
        if (error != null || status >= 400) {
            throw new AuthException(AuthException.Reason.REJECTED_CREDENTIALS,
                    "Error while getting access token. Server replied '" + (error != null ? error : "status " + status) + "'");
        }
        throw new IOException("Token endpoint response carried no access token (status " + status + ")");
    }

    private String formBody() {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("client_id", credentials.clientId());
        form.put("client_secret", credentials.clientSecret());
        form.put("refresh_token", credentials.refreshToken());
        form.put("grant_type", "refresh_token");
        return form.entrySet().stream()
                .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                        + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }
}
