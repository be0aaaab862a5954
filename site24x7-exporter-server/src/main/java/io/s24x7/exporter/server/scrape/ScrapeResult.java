package io.s24x7.exporter.server.scrape;

import java.time.Duration;

/**
 * Outcome of one scrape.
 *
 * @param failedStage stage that failed, {@code null} on success
 * @param error       failure message, {@code null} on success
 * @param monitors    number of monitors published, 0 on failure
 */
public record ScrapeResult(ScrapeStage failedStage, String error, int monitors, Duration duration) {

    public static ScrapeResult success(int monitors, Duration duration) {
        return new ScrapeResult(null, null, monitors, duration);
    }

    public static ScrapeResult failure(ScrapeStage stage, String error, Duration duration) {
        return new ScrapeResult(stage, error, 0, duration);
    }

    public boolean isSuccess() {
        return failedStage == null;
    }
}
