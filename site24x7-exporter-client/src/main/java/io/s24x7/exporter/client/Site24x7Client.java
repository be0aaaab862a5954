package io.s24x7.exporter.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.s24x7.exporter.client.auth.AccessToken;
import io.s24x7.exporter.client.model.Monitor;
import io.s24x7.exporter.client.model.MonitorGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only client for the Site24x7 endpoints the exporter needs.
 *
 * Usage:
 * <pre>
 * Site24x7Client client = new Site24x7Client(httpClient, settings);
 * List&lt;MonitorGroup&gt; groups = client.listMonitorGroups(token);
 * List&lt;Monitor&gt; monitors = client.listMonitors(token);
 * </pre>
 *
 * Both listings follow {@code info.has_more_page} across pages. A rejected token surfaces as
 * {@link AuthException} with reason {@link AuthException.Reason#TOKEN_REJECTED}, any other
 * failure of the call as {@link FetchException}. Entries that fail to decode are logged and
 * isolated from the rest of the batch.
 */
public class Site24x7Client {

    private static final Logger log = LoggerFactory.getLogger(Site24x7Client.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String ACCEPT_HEADER = "application/json; version=2.0";
    static final String AUTH_SCHEME = "Zoho-oauthtoken ";
    static final String INVALID_TOKEN_MESSAGE = "OAuth Access Token is invalid or has expired.";

    static final String CURRENT_STATUS_PATH = "/current_status";
    static final String MONITOR_GROUPS_PATH = "/monitor_groups";

    private final HttpClient httpClient;
    private final ClientSettings settings;
    private final MonitorDecoder decoder;

    public Site24x7Client(HttpClient httpClient, ClientSettings settings) {
        this(httpClient, settings, new MonitorDecoder());
    }

    public Site24x7Client(HttpClient httpClient, ClientSettings settings, MonitorDecoder decoder) {
        this.httpClient = httpClient;
        this.settings = settings;
        this.decoder = decoder;
    }

    /**
     * List all monitor groups with their member monitor ids.
     */
    public List<MonitorGroup> listMonitorGroups(AccessToken token) {
        List<MonitorGroup> groups = new ArrayList<>();
        for (JsonNode data : getAllPages(MONITOR_GROUPS_PATH, token)) {
            if (data.isMissingNode() || data.isNull()) {
                continue;
            }
            if (!data.isArray()) {
                throw new FetchException("Unexpected shape of " + MONITOR_GROUPS_PATH + " response: 'data' is not an array");
            }
            for (JsonNode entry : data) {
                try {
                    groups.add(decoder.decodeGroup(entry));
                } catch (DecodeException e) {
                    log.warn("Skipping monitor group {}: {}", entry.path("group_id").asText("<unknown>"), e.getMessage());
                }
            }
        }
        log.debug("Fetched {} monitor groups", groups.size());
        return groups;
    }

    /**
     * List the current status of all monitors, grouped or not. Each monitor appears once.
     */
    public List<Monitor> listMonitors(AccessToken token) {
        Map<String, Monitor> monitors = new LinkedHashMap<>();
        int skipped = 0;
        for (JsonNode data : getAllPages(CURRENT_STATUS_PATH, token)) {
            if (data.isMissingNode() || data.isNull()) {
                continue;
            }
            if (!data.isObject()) {
                throw new FetchException("Unexpected shape of " + CURRENT_STATUS_PATH + " response: 'data' is not an object");
            }
            skipped += collectMonitors(data.path("monitors"), monitors);
            for (JsonNode group : data.path("monitor_groups")) {
                skipped += collectMonitors(group.path("monitors"), monitors);
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} monitors without a readable monitor_id", skipped);
        }
        log.debug("Fetched {} monitors", monitors.size());
        return new ArrayList<>(monitors.values());
    }

    private int collectMonitors(JsonNode entries, Map<String, Monitor> into) {
        int skipped = 0;
        for (JsonNode entry : entries) {
            Monitor monitor;
            try {
                monitor = decoder.decodeMonitor(entry);
            } catch (DecodeException e) {
                String key = entry.path("monitor_id").asText("");
                log.warn("Couldn't decode monitor '{}' ({}): {}", key.isEmpty() ? "<unknown>" : key,
                        entry.path("name").asText(""), e.getMessage());
                if (key.isEmpty()) {
                    skipped++;
                    continue;
                }
                monitor = Monitor.undecodable(key, entry.path("name").asText(""), entry.path("monitor_type").asText(""));
            }
            into.putIfAbsent(monitor.id(), monitor);
        }
        return skipped;
    }

    private List<JsonNode> getAllPages(String path, AccessToken token) {
        List<JsonNode> pages = new ArrayList<>();
        int page = 1;
        while (true) {
            JsonNode envelope = get(path, page, token);
            pages.add(envelope.path("data"));
            if (!envelope.path("info").path("has_more_page").asBoolean(false)) {
                return pages;
            }
            if (page >= settings.getMaxPages()) {
                throw new FetchException(path + " has more than " + settings.getMaxPages() + " pages");
            }
            page++;
        }
    }

    private JsonNode get(String path, int page, AccessToken token) {
        String url = settings.getApiUrl() + path + (page > 1 ? "?page=" + page : "");
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Accept", ACCEPT_HEADER)
                .header("Authorization", AUTH_SCHEME + token.value())
                .timeout(settings.getRequestTimeout())
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new FetchException("Request to " + url + " timed out after " + settings.getRequestTimeout().toMillis() + "ms", e);
        } catch (ConnectException e) {
            throw new FetchException("Couldn't connect to " + url + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new FetchException("Error during request to " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("Interrupted during request to " + url, e);
        }

        int status = response.statusCode();
        if (status == 401) {
            throw new AuthException(AuthException.Reason.TOKEN_REJECTED, "API rejected the access token (status 401)");
        }

        String body = response.body();
        if (body == null || body.isBlank()) {
            throw new FetchException("Empty response from " + url, status);
        }

        JsonNode envelope;
        try {
            envelope = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FetchException("Couldn't parse response from " + url + " (status " + status + "): " + e.getOriginalMessage(), status);
        }
        if (log.isTraceEnabled()) {
            log.trace("JSON received from {}:\n{}", url, envelope.toPrettyString());
        }

        String message = envelope.path("message").asText("");
        if (INVALID_TOKEN_MESSAGE.equals(message)) {
            throw new AuthException(AuthException.Reason.TOKEN_REJECTED, "API error: " + message);
        }
        boolean errorEnvelope = envelope.has("error_code") || envelope.path("code").asInt(0) != 0;
        if (status < 200 || status >= 300 || errorEnvelope) {
            String code = envelope.path("error_code").asText(envelope.path("code").asText(""));
            throw new FetchException("API error from " + url + " (status " + status
                    + (code.isEmpty() ? "" : ", code " + code) + "): " + message, status);
        }
        if (!envelope.isObject()) {
            throw new FetchException("Unexpected response from " + url + ": not a JSON object", status);
        }
        return envelope;
    }
}
