package io.s24x7.exporter.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.Proxy;
import java.net.ProxySelector;
import java.net.SocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Outbound proxy selection from the conventional {@code *_PROXY} environment variables.
 *
 * <ul>
 *     <li>{@code HTTPS_PROXY} / {@code https_proxy} for https targets</li>
 *     <li>{@code HTTP_PROXY} / {@code http_proxy} for http targets</li>
 *     <li>{@code ALL_PROXY} / {@code all_proxy} as fallback for both</li>
 *     <li>{@code NO_PROXY} / {@code no_proxy}: comma separated hosts or domain suffixes, or {@code *}</li>
 * </ul>
 *
 * User info embedded in a proxy URL is used for proxy authentication and never logged.
 */
public final class ProxySettings {

    private static final Logger log = LoggerFactory.getLogger(ProxySettings.class);

    private final URI httpProxy;
    private final URI httpsProxy;
    private final List<String> noProxy;

    private ProxySettings(URI httpProxy, URI httpsProxy, List<String> noProxy) {
        this.httpProxy = httpProxy;
        this.httpsProxy = httpsProxy;
        this.noProxy = List.copyOf(noProxy);
    }

    public static ProxySettings none() {
        return new ProxySettings(null, null, List.of());
    }

    public static ProxySettings fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    public static ProxySettings fromEnvironment(Map<String, String> env) {
        URI all = parseProxy(firstNonBlank(env, "ALL_PROXY", "all_proxy"));
        URI http = parseProxy(firstNonBlank(env, "HTTP_PROXY", "http_proxy"));
        URI https = parseProxy(firstNonBlank(env, "HTTPS_PROXY", "https_proxy"));
        String noProxyValue = firstNonBlank(env, "NO_PROXY", "no_proxy");
        List<String> noProxy = noProxyValue == null ? List.of() : Arrays.stream(noProxyValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(ProxySettings::normalizeNoProxyEntry)
                .collect(Collectors.toList());
        return new ProxySettings(http != null ? http : all, https != null ? https : all, noProxy);
    }

    public boolean isEmpty() {
        return httpProxy == null && httpsProxy == null;
    }

    public URI getHttpProxy() {
        return httpProxy;
    }

    public URI getHttpsProxy() {
        return httpsProxy;
    }

    public List<String> getNoProxy() {
        return noProxy;
    }

    /**
     * Install the proxy selector (and authenticator, when a proxy URL carries credentials).
     */
    public HttpClient.Builder applyTo(HttpClient.Builder builder) {
        if (isEmpty()) {
            return builder;
        }
        builder.proxy(new EnvironmentProxySelector());
        if (hasCredentials(httpProxy) || hasCredentials(httpsProxy)) {
            builder.authenticator(new ProxyAuthenticator());
        }
        return builder;
    }

    /**
     * Log which proxies are active. Credentials are redacted.
     */
    public void logActiveProxies() {
        if (isEmpty()) {
            log.info("Not using any proxies");
            return;
        }
        log.info("Picked up proxies: {}", describe());
        if (hasCredentials(httpsProxy)) {
            log.info("HTTPS proxy credentials are only sent when Basic is not listed in jdk.http.auth.tunneling.disabledSchemes");
        }
    }

    /**
     * Human readable summary without user info, e.g. {@code https=http://proxy:3128, no_proxy=[.internal]}.
     */
    public String describe() {
        List<String> parts = new ArrayList<>();
        if (httpsProxy != null) {
            parts.add("https=" + redact(httpsProxy));
        }
        if (httpProxy != null) {
            parts.add("http=" + redact(httpProxy));
        }
        if (!noProxy.isEmpty()) {
            parts.add("no_proxy=" + noProxy);
        }
        return String.join(", ", parts);
    }

    @Override
    public String toString() {
        return "ProxySettings{" + describe() + "}";
    }

    static String redact(URI uri) {
        String port = uri.getPort() == -1 ? "" : ":" + uri.getPort();
        return uri.getScheme() + "://" + uri.getHost() + port;
    }

    boolean bypasses(String host) {
        if (host == null) {
            return false;
        }
        String h = host.toLowerCase(Locale.ROOT);
        for (String entry : noProxy) {
            if (entry.equals("*") || h.equals(entry) || h.endsWith("." + entry)) {
                return true;
            }
        }
        return false;
    }

    URI proxyFor(URI target) {
        if (target == null || bypasses(target.getHost())) {
            return null;
        }
        return "https".equalsIgnoreCase(target.getScheme()) ? httpsProxy : httpProxy;
    }

    private static String firstNonBlank(Map<String, String> env, String... names) {
        return Stream.of(names)
                .map(env::get)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .findFirst()
                .orElse(null);
    }

    private static URI parseProxy(String value) {
        if (value == null) {
            return null;
        }
        String withScheme = value.contains("://") ? value : "http://" + value;
        try {
            URI uri = URI.create(withScheme);
            if (uri.getHost() == null) {
                log.warn("Ignoring proxy setting without host: {}", redactUnparsed(value));
                return null;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                log.warn("Ignoring unsupported {} proxy {}", scheme, redact(uri));
                return null;
            }
            return uri;
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed proxy setting: {}", redactUnparsed(value));
            return null;
        }
    }

    private static String redactUnparsed(String value) {
        int at = value.lastIndexOf('@');
        return at < 0 ? value : "***@" + value.substring(at + 1);
    }

    private static String normalizeNoProxyEntry(String entry) {
        String e = entry.toLowerCase(Locale.ROOT);
        if (e.startsWith("*.")) {
            e = e.substring(2);
        } else if (e.startsWith(".")) {
            e = e.substring(1);
        }
        int colon = e.indexOf(':');
        return colon > 0 ? e.substring(0, colon) : e;
    }

    private static boolean hasCredentials(URI uri) {
        return uri != null && uri.getRawUserInfo() != null;
    }

    private class EnvironmentProxySelector extends ProxySelector {

        @Override
        public List<Proxy> select(URI uri) {
            URI proxy = proxyFor(uri);
            if (proxy == null) {
                return List.of(Proxy.NO_PROXY);
            }
            int port = proxy.getPort() != -1 ? proxy.getPort() : ("https".equalsIgnoreCase(proxy.getScheme()) ? 443 : 80);
            return List.of(new Proxy(Proxy.Type.HTTP, InetSocketAddress.createUnresolved(proxy.getHost(), port)));
        }

        @Override
        public void connectFailed(URI uri, SocketAddress sa, IOException ioe) {
            log.warn("Connection to proxy {} failed for {}: {}", sa, uri.getHost(), ioe.getMessage());
        }
    }

    private class ProxyAuthenticator extends Authenticator {

        @Override
        protected PasswordAuthentication getPasswordAuthentication() {
            if (getRequestorType() != RequestorType.PROXY) {
                return null;
            }
            for (URI proxy : new URI[]{httpsProxy, httpProxy}) {
                if (hasCredentials(proxy) && proxy.getHost().equalsIgnoreCase(getRequestingHost())) {
                    String userInfo = proxy.getRawUserInfo();
                    int colon = userInfo.indexOf(':');
                    String user = colon < 0 ? userInfo : userInfo.substring(0, colon);
                    String password = colon < 0 ? "" : userInfo.substring(colon + 1);
                    return new PasswordAuthentication(
                            URLDecoder.decode(user, StandardCharsets.UTF_8),
                            URLDecoder.decode(password, StandardCharsets.UTF_8).toCharArray());
                }
            }
            return null;
        }
    }
}
