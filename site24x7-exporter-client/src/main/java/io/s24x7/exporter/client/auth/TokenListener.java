package io.s24x7.exporter.client.auth;

/**
 * Callback for token exchange outcomes, used for exporter self-metrics.
 */
public interface TokenListener {

    TokenListener NOOP = new TokenListener() {
    };

    default void onExchangeSucceeded() {
    }

    default void onExchangeFailed(Throwable error) {
    }
}
