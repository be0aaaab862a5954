package io.s24x7.exporter.server.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.s24x7.exporter.client.auth.TokenListener;
import io.s24x7.exporter.server.scrape.ScrapeStage;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * The exporter's own health metrics.
 */
public final class ExporterMetrics implements TokenListener {

    private final Map<ScrapeStage, Counter> scrapeErrors = new EnumMap<>(ScrapeStage.class);
    private final Counter decodeErrors;
    private final Counter tokenExchangeSuccess;
    private final Counter tokenExchangeFailure;
    private final Timer scrapeDuration;
    private final GaugeValue lastScrapeSuccess = new GaugeValue(0);

    public ExporterMetrics(MeterRegistry registry) {
        for (ScrapeStage stage : ScrapeStage.values()) {
            scrapeErrors.put(stage, Counter.builder("site24x7.exporter.scrape.errors")
                    .description("Failed scrapes by pipeline stage")
                    .tag("stage", stage.label())
                    .register(registry));
        }
        this.decodeErrors = Counter.builder("site24x7.exporter.decode.errors")
                .description("Monitors whose payload could not be decoded")
                .register(registry);
        this.tokenExchangeSuccess = tokenExchanges(registry, "success");
        this.tokenExchangeFailure = tokenExchanges(registry, "failure");
        this.scrapeDuration = Timer.builder("site24x7.exporter.scrape.duration")
                .description("Duration of the scrape pipeline")
                .register(registry);
        Gauge.builder("site24x7.exporter.last.scrape.success", lastScrapeSuccess, GaugeValue::get)
                .description("1 when the last scrape published fresh data, else 0")
                .strongReference(true)
                .register(registry);
    }

    private static Counter tokenExchanges(MeterRegistry registry, String outcome) {
        return Counter.builder("site24x7.exporter.token.exchanges")
                .description("OAuth token exchanges by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }

    public void recordScrapeSuccess(Duration duration) {
        scrapeDuration.record(duration);
        lastScrapeSuccess.set(1);
    }

    public void recordScrapeFailure(ScrapeStage stage, Duration duration) {
        scrapeDuration.record(duration);
        scrapeErrors.get(stage).increment();
        lastScrapeSuccess.set(0);
    }

    public void recordDecodeErrors(int count) {
        if (count > 0) {
            decodeErrors.increment(count);
        }
    }

    @Override
    public void onExchangeSucceeded() {
        tokenExchangeSuccess.increment();
    }

    @Override
    public void onExchangeFailed(Throwable error) {
        tokenExchangeFailure.increment();
    }

    public double scrapeErrorCount(ScrapeStage stage) {
        return scrapeErrors.get(stage).count();
    }

    public boolean isLastScrapeSuccessful() {
        return lastScrapeSuccess.get() == 1;
    }
}
