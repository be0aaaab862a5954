package io.s24x7.exporter.server.scrape;

import java.util.Locale;

/**
 * Steps of one scrape, in order.
 */
public enum ScrapeStage {
    REQUEST_TOKEN,
    FETCH,
    UPDATE_REGISTRY,
    PUBLISH_SNAPSHOT;

    /**
     * Value of the {@code stage} label.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
