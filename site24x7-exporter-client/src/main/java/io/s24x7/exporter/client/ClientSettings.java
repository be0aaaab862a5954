package io.s24x7.exporter.client;

import java.time.Duration;

/**
 * Settings shared by {@link Site24x7Client} and the token manager.
 * Provides default values and builder pattern for customization.
 */
public class ClientSettings {

    private final String apiUrl;
    private final String accountsUrl;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final int maxPages;
    private final Duration tokenExpirySafetyMargin;
    private final int tokenMaxRetries;
    private final Duration tokenRetryDelay;
    private final boolean logSecrets;

    private ClientSettings(Builder builder) {
        this.apiUrl = stripTrailingSlash(builder.apiUrl);
        this.accountsUrl = stripTrailingSlash(builder.accountsUrl);
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.maxPages = builder.maxPages;
        this.tokenExpirySafetyMargin = builder.tokenExpirySafetyMargin;
        this.tokenMaxRetries = builder.tokenMaxRetries;
        this.tokenRetryDelay = builder.tokenRetryDelay;
        this.logSecrets = builder.logSecrets;
    }

    public String getApiUrl() {
        return apiUrl;
    }

    public String getAccountsUrl() {
        return accountsUrl;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public int getMaxPages() {
        return maxPages;
    }

    public Duration getTokenExpirySafetyMargin() {
        return tokenExpirySafetyMargin;
    }

    public int getTokenMaxRetries() {
        return tokenMaxRetries;
    }

    public Duration getTokenRetryDelay() {
        return tokenRetryDelay;
    }

    /**
     * Whether tokens and client secrets may be written to DEBUG logs.
     */
    public boolean isLogSecrets() {
        return logSecrets;
    }

    public static Builder builder(Site24x7Region region) {
        return new Builder()
                .apiUrl(region.apiUrl())
                .accountsUrl(region.accountsUrl());
    }

    public static Builder builder() {
        return builder(Site24x7Region.COM);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    public static class Builder {
        private String apiUrl;
        private String accountsUrl;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private int maxPages = 20;
        private Duration tokenExpirySafetyMargin = Duration.ofSeconds(60);
        private int tokenMaxRetries = 2;
        private Duration tokenRetryDelay = Duration.ofMillis(500);
        private boolean logSecrets = false;

        private Builder() {
        }

        public Builder apiUrl(String apiUrl) {
            this.apiUrl = requireNonBlank(apiUrl, "apiUrl");
            return this;
        }

        public Builder accountsUrl(String accountsUrl) {
            this.accountsUrl = requireNonBlank(accountsUrl, "accountsUrl");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requirePositive(connectTimeout, "connectTimeout");
            return this;
        }

        /**
         * Hard timeout of every outbound request.
         * @param requestTimeout timeout (must be positive)
         * @return this builder
         */
        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requirePositive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder maxPages(int maxPages) {
            if (maxPages <= 0) {
                throw new IllegalArgumentException("maxPages must be positive, got: " + maxPages);
            }
            this.maxPages = maxPages;
            return this;
        }

        public Builder tokenExpirySafetyMargin(Duration margin) {
            if (margin == null || margin.isNegative()) {
                throw new IllegalArgumentException("tokenExpirySafetyMargin must not be negative, got: " + margin);
            }
            this.tokenExpirySafetyMargin = margin;
            return this;
        }

        public Builder tokenMaxRetries(int tokenMaxRetries) {
            if (tokenMaxRetries < 0) {
                throw new IllegalArgumentException("tokenMaxRetries must not be negative, got: " + tokenMaxRetries);
            }
            this.tokenMaxRetries = tokenMaxRetries;
            return this;
        }

        public Builder tokenRetryDelay(Duration tokenRetryDelay) {
            if (tokenRetryDelay == null || tokenRetryDelay.isNegative()) {
                throw new IllegalArgumentException("tokenRetryDelay must not be negative, got: " + tokenRetryDelay);
            }
            this.tokenRetryDelay = tokenRetryDelay;
            return this;
        }

        public Builder logSecrets(boolean logSecrets) {
            this.logSecrets = logSecrets;
            return this;
        }

        public ClientSettings build() {
            return new ClientSettings(this);
        }

        private static String requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be positive, got: " + value);
            }
            return value;
        }
    }
}
