package io.s24x7.exporter.client.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Short-lived OAuth access token. {@link #toString()} never prints the token value.
 */
public record AccessToken(String value, Instant expiresAt) {

    public AccessToken {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    /**
     * True while the expiry is more than {@code safetyMargin} after {@code now}.
     */
    public boolean isUsableAt(Instant now, Duration safetyMargin) {
        return expiresAt.isAfter(now.plus(safetyMargin));
    }

    @Override
    public String toString() {
        return "AccessToken[value=***, expiresAt=" + expiresAt + "]";
    }
}
