package io.s24x7.exporter.server.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.s24x7.exporter.client.ClientSettings;
import io.s24x7.exporter.client.Site24x7Region;
import io.s24x7.exporter.client.auth.Credentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Loads exporter configuration from HOCON files.
 *
 * Sources, later ones override earlier ones:
 * 1. application.conf from classpath (defaults, credentials from {@code ZOHO_*} environment variables)
 * 2. File given with -c/--config
 * 3. {@code --conf key=value} arguments
 * 4. System properties
 *
 * <pre>
 * site24x7_exporter {
 *     endpoint = "site24x7.eu"
 *     credentials {
 *         client-id = "1000.XXXX"
 *         client-secret = "..."
 *         refresh-token = "..."
 *     }
 *     web { port = 9803, telemetry-path = "/metrics" }
 * }
 * </pre>
 *
 * Getters throw {@link InvalidConfigurationException} for missing or malformed values;
 * {@link #validate()} checks everything at once.
 */
public class ExporterConfig {

    private static final Logger log = LoggerFactory.getLogger(ExporterConfig.class);
    static final String CONFIG_PREFIX = "site24x7_exporter";

    private final Config config;

    /**
     * Load configuration from the classpath and system properties only.
     */
    public ExporterConfig() {
        this(null, List.of());
    }

    /**
     * Load configuration with an optional external file and {@code key=value} overrides.
     *
     * @param externalConfigPath path to an external config file (can be null)
     * @param overrides          HOCON {@code path=value} assignments with full paths, e.g.
     *                           {@code site24x7_exporter.web.port=9100}
     * @throws InvalidConfigurationException if the file does not exist or an override is malformed
     */
    public ExporterConfig(String externalConfigPath, List<String> overrides) {
        Config resultConfig = ConfigFactory.load();

        if (externalConfigPath != null && !externalConfigPath.isEmpty()) {
            File externalFile = new File(externalConfigPath);
            if (!externalFile.isFile()) {
                throw new InvalidConfigurationException("Configuration file not found: " + externalConfigPath);
            }
            log.info("Loading external configuration from: {}", externalConfigPath);
            try {
                resultConfig = ConfigFactory.parseFile(externalFile).withFallback(resultConfig);
            } catch (ConfigException e) {
                throw new InvalidConfigurationException("Couldn't parse " + externalConfigPath + ": " + e.getMessage(), e);
            }
        }

        if (overrides != null) {
            for (String override : overrides) {
                resultConfig = parseOverride(override).withFallback(resultConfig);
            }
        }

        try {
            this.config = ConfigFactory.systemProperties()
                    .withFallback(resultConfig)
                    .resolve();
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Couldn't resolve configuration: " + e.getMessage(), e);
        }
        log.debug("Configuration loaded successfully");
    }

    /**
     * Create ExporterConfig from an existing Config object.
     */
    public ExporterConfig(Config config) {
        this.config = config;
    }

    public Config getConfig() {
        return config;
    }

    /**
     * Read every setting once so that configuration errors surface before the server starts.
     *
     * @throws InvalidConfigurationException for the first problem found
     */
    public ExporterConfig validate() {
        getRegion();
        getApiUrl();
        getAccountsUrl();
        getCredentials();
        getWebHost();
        getWebPort();
        getTelemetryPath();
        getGeolocationPath();
        toClientSettings();
        getScrapeTimeout();
        if (getTelemetryPath().equals(getGeolocationPath())) {
            throw new InvalidConfigurationException("web.telemetry-path and web.geolocation-path must differ");
        }
        return this;
    }

    /**
     * Regional endpoint selected with {@code endpoint}.
     */
    public Site24x7Region getRegion() {
        String endpoint = getString("endpoint");
        try {
            return Site24x7Region.fromDomain(endpoint.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Unknown Site24x7 endpoint '" + endpoint
                    + "', expected one of site24x7.com, site24x7.eu, site24x7.cn, site24x7.in, site24x7.net.au");
        }
    }

    public String getApiUrl() {
        return getOptionalUrl("api-url", getRegion().apiUrl());
    }

    public String getAccountsUrl() {
        return getOptionalUrl("accounts-url", getRegion().accountsUrl());
    }

    public Credentials getCredentials() {
        return new Credentials(
                getSecret("credentials.client-id", "ZOHO_CLIENT_ID"),
                getSecret("credentials.client-secret", "ZOHO_CLIENT_SECRET"),
                getSecret("credentials.refresh-token", "ZOHO_REFRESH_TOKEN"));
    }

    public String getWebHost() {
        return getString("web.host");
    }

    public int getWebPort() {
        int port = read("web.port", config::getInt);
        if (port < 0 || port > 65535) {
            throw new InvalidConfigurationException("web.port must be between 0 and 65535, got: " + port);
        }
        return port;
    }

    public String getTelemetryPath() {
        return getPath("web.telemetry-path");
    }

    public String getGeolocationPath() {
        return getPath("web.geolocation-path");
    }

    public Duration getConnectTimeout() {
        return getPositiveDuration("http.connect-timeout");
    }

    public Duration getRequestTimeout() {
        return getPositiveDuration("http.request-timeout");
    }

    public int getMaxPages() {
        int maxPages = read("http.max-pages", config::getInt);
        if (maxPages <= 0) {
            throw new InvalidConfigurationException("http.max-pages must be positive, got: " + maxPages);
        }
        return maxPages;
    }

    public Duration getExpirySafetyMargin() {
        Duration margin = read("auth.expiry-safety-margin", config::getDuration);
        if (margin.isNegative()) {
            throw new InvalidConfigurationException("auth.expiry-safety-margin must not be negative, got: " + margin);
        }
        return margin;
    }

    public int getAuthMaxRetries() {
        int retries = read("auth.max-retries", config::getInt);
        if (retries < 0) {
            throw new InvalidConfigurationException("auth.max-retries must not be negative, got: " + retries);
        }
        return retries;
    }

    public Duration getAuthRetryDelay() {
        Duration delay = read("auth.retry-delay", config::getDuration);
        if (delay.isNegative()) {
            throw new InvalidConfigurationException("auth.retry-delay must not be negative, got: " + delay);
        }
        return delay;
    }

    /**
     * Whether tokens and client secrets may be written to DEBUG logs.
     */
    public boolean isLogSecrets() {
        return read("auth.log-secrets", config::getBoolean);
    }

    /**
     * Upper bound of each upstream fetch within one scrape.
     */
    public Duration getScrapeTimeout() {
        return getPositiveDuration("scrape.timeout");
    }

    public ClientSettings toClientSettings() {
        try {
            return ClientSettings.builder(getRegion())
                    .apiUrl(getApiUrl())
                    .accountsUrl(getAccountsUrl())
                    .connectTimeout(getConnectTimeout())
                    .requestTimeout(getRequestTimeout())
                    .maxPages(getMaxPages())
                    .tokenExpirySafetyMargin(getExpirySafetyMargin())
                    .tokenMaxRetries(getAuthMaxRetries())
                    .tokenRetryDelay(getAuthRetryDelay())
                    .logSecrets(isLogSecrets())
                    .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException(e.getMessage(), e);
        }
    }

    private static Config parseOverride(String override) {
        if (override == null || override.indexOf('=') <= 0) {
            throw new InvalidConfigurationException("Expected key=value, got: " + override);
        }
        try {
            return ConfigFactory.parseString(override);
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid override '" + override + "': " + e.getMessage(), e);
        }
    }

    private String getSecret(String path, String environmentVariable) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (!config.hasPath(fullPath)) {
            throw new InvalidConfigurationException("Missing " + fullPath
                    + " (or environment variable " + environmentVariable + ")");
        }
        String value = read(path, config::getString);
        if (value.isBlank()) {
            throw new InvalidConfigurationException(fullPath + " must not be blank");
        }
        return value.trim();
    }

    private String getOptionalUrl(String path, String defaultValue) {
        String fullPath = CONFIG_PREFIX + "." + path;
        if (!config.hasPath(fullPath)) {
            return defaultValue;
        }
        String url = read(path, config::getString).trim();
        if (!url.startsWith("http://") && !url.startsWith("https://")) {
            throw new InvalidConfigurationException(fullPath + " must be an http(s) URL, got: " + url);
        }
        return url;
    }

    private String getPath(String path) {
        String value = getString(path);
        if (!value.startsWith("/")) {
            throw new InvalidConfigurationException(CONFIG_PREFIX + "." + path + " must start with '/', got: " + value);
        }
        return value;
    }

    private Duration getPositiveDuration(String path) {
        Duration duration = read(path, config::getDuration);
        if (duration.isZero() || duration.isNegative()) {
            throw new InvalidConfigurationException(CONFIG_PREFIX + "." + path + " must be positive, got: " + duration);
        }
        return duration;
    }

    private String getString(String path) {
        return read(path, config::getString);
    }

    private <T> T read(String path, Function<String, T> getter) {
        String fullPath = CONFIG_PREFIX + "." + path;
        try {
            return getter.apply(fullPath);
        } catch (ConfigException.Missing e) {
            throw new InvalidConfigurationException("Missing configuration " + fullPath, e);
        } catch (ConfigException e) {
            throw new InvalidConfigurationException("Invalid configuration " + fullPath + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "ExporterConfig{" +
                "endpoint=" + getString("endpoint") +
                ", apiUrl='" + getApiUrl() + '\'' +
                ", accountsUrl='" + getAccountsUrl() + '\'' +
                ", listen=" + getWebHost() + ":" + getWebPort() +
                ", telemetryPath='" + getTelemetryPath() + '\'' +
                ", geolocationPath='" + getGeolocationPath() + '\'' +
                ", requestTimeout=" + getRequestTimeout() +
                ", scrapeTimeout=" + getScrapeTimeout() +
                '}';
    }
}
