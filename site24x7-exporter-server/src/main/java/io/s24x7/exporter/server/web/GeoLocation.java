package io.s24x7.exporter.server.web;

/**
 * A Site24x7 polling location. {@code key} matches the {@code location} label of the
 * per-location metrics.
 */
public record GeoLocation(String key, String name, double latitude, double longitude) {
}
