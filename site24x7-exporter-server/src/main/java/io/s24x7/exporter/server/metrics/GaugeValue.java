package io.s24x7.exporter.server.metrics;

/**
 * Mutable value behind a gauge.
 */
final class GaugeValue {

    private volatile double value;

    GaugeValue(double initial) {
        this.value = initial;
    }

    double get() {
        return value;
    }

    void set(double value) {
        this.value = value;
    }
}
