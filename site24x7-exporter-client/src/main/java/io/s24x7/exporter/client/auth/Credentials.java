package io.s24x7.exporter.client.auth;

import java.util.Objects;

/**
 * Zoho OAuth client credentials plus the long-lived refresh token.
 * {@link #toString()} never prints the secrets.
 */
public record Credentials(String clientId, String clientSecret, String refreshToken) {

    public Credentials {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(clientSecret, "clientSecret");
        Objects.requireNonNull(refreshToken, "refreshToken");
    }

    @Override
    public String toString() {
        return "Credentials[clientId=" + clientId + ", clientSecret=***, refreshToken=***]";
    }
}
