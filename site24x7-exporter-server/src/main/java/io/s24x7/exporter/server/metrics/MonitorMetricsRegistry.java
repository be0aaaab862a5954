package io.s24x7.exporter.server.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.s24x7.exporter.client.model.Monitor;
import io.s24x7.exporter.client.model.MonitorGroup;
import io.s24x7.exporter.client.model.MonitorLocation;
import io.s24x7.exporter.client.model.MonitorStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Maps monitors onto Prometheus gauges and owns the exported snapshot.
 *
 * <ul>
 *     <li>{@code site24x7_monitor_up}: Site24x7 status code, -1 when the poll was unusable</li>
 *     <li>{@code site24x7_monitor_latency_seconds}: last response time, +Inf when down</li>
 *     <li>{@code site24x7_monitor_unavailable}: 1 when the poll carried no usable value</li>
 *     <li>{@code site24x7_monitor_location_up} and {@code site24x7_monitor_location_latency_seconds}
 *     per polling location</li>
 * </ul>
 *
 * A poll without a usable value keeps the previous latency. Every monitor and location that
 * is missing from an update is removed together with all its series. Updates and
 * {@link #scrape()} are serialized, so a scrape never renders a half-applied update.
 */
public class MonitorMetricsRegistry {

    private static final Logger log = LoggerFactory.getLogger(MonitorMetricsRegistry.class);

    static final String MONITOR_UP = "site24x7.monitor.up";
    static final String MONITOR_LATENCY = "site24x7.monitor.latency";
    static final String MONITOR_UNAVAILABLE = "site24x7.monitor.unavailable";
    static final String LOCATION_UP = "site24x7.monitor.location.up";
    static final String LOCATION_LATENCY = "site24x7.monitor.location.latency";

    static final String TAG_ID = "monitor_id";
    static final String TAG_NAME = "monitor_name";
    static final String TAG_TYPE = "monitor_type";
    static final String TAG_GROUP = "monitor_group";
    static final String TAG_LOCATION = "location";

    private final PrometheusMeterRegistry registry;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TrackedMonitor> tracked = new LinkedHashMap<>();

    public MonitorMetricsRegistry() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    public MonitorMetricsRegistry(PrometheusMeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Registry the exporter's own meters are registered with, so they end up in the same snapshot.
     */
    public MeterRegistry getMeterRegistry() {
        return registry;
    }

    /**
     * Apply one complete poll. {@code groups} replaces all previous group membership.
     */
    public void update(List<Monitor> monitors, List<MonitorGroup> groups) {
        Map<String, String> groupLabels = groupLabels(groups);
        lock.writeLock().lock();
        try {
            Set<String> seen = new HashSet<>();
            for (Monitor monitor : monitors) {
                if (!seen.add(monitor.id())) {
                    log.debug("Ignoring duplicate monitor {}", monitor.id());
                    continue;
                }
                apply(monitor, groupLabels.getOrDefault(monitor.id(), ""));
            }

            Iterator<Map.Entry<String, TrackedMonitor>> it = tracked.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, TrackedMonitor> entry = it.next();
                if (!seen.contains(entry.getKey())) {
                    log.info("Monitor {} ({}) is gone, removing its metrics", entry.getKey(), entry.getValue().name);
                    entry.getValue().remove(registry);
                    it.remove();
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Render the current snapshot in the Prometheus text format.
     */
    public String scrape() {
        lock.readLock().lock();
        try {
            return registry.scrape();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Ids of the monitors that currently have series.
     */
    public Set<String> trackedMonitorIds() {
        lock.readLock().lock();
        try {
            return Set.copyOf(tracked.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void apply(Monitor monitor, String groupLabel) {
        TrackedMonitor current = tracked.get(monitor.id());

        if (!monitor.decoded()) {
            // keep the last known name, type and values, only the group label follows the new groups
            if (current == null) {
                current = register(monitor.id(), monitor.name(), baseTags(monitor, groupLabel),
                        monitor.type().hasPerformanceValue(), null);
                tracked.put(monitor.id(), current);
            } else {
                Tags tags = current.tags.and(TAG_GROUP, groupLabel);
                if (!tags.equals(current.tags)) {
                    log.debug("Group label of undecodable monitor {} changed to '{}'", monitor.id(), groupLabel);
                    current.remove(registry);
                    current = register(monitor.id(), current.name, tags, current.withLatency, current);
                    tracked.put(monitor.id(), current);
                }
            }
            current.up.set(MonitorStatus.UNKNOWN.code());
            current.unavailable.set(1);
            for (TrackedLocation location : current.locations.values()) {
                location.up.set(MonitorStatus.UNKNOWN.code());
            }
            return;
        }

        Tags tags = baseTags(monitor, groupLabel);
        boolean withLatency = monitor.type().hasPerformanceValue();
        if (current == null || !current.tags.equals(tags) || current.withLatency != withLatency) {
            if (current != null) {
                log.debug("Labels of monitor {} changed from {} to {}", monitor.id(), current.tags, tags);
                current.remove(registry);
            }
            current = register(monitor.id(), monitor.name(), tags, withLatency, current);
            tracked.put(monitor.id(), current);
        }

        current.up.set(monitor.status().code());
        boolean usable = monitor.status() != MonitorStatus.UNKNOWN;
        if (withLatency) {
            Double latency = latencySeconds(monitor.status(), monitor.value());
            if (latency != null) {
                current.latency.set(latency);
            } else {
                usable = false;
            }
        }
        current.unavailable.set(usable ? 0 : 1);

        applyLocations(current, monitor.locations());
    }

    private void applyLocations(TrackedMonitor monitor, List<MonitorLocation> locations) {
        Set<String> seen = new HashSet<>();
        for (MonitorLocation location : locations) {
            if (!seen.add(location.name())) {
                continue;
            }
            TrackedLocation current = monitor.locations.get(location.name());
            if (current == null) {
                current = new TrackedLocation(registry, monitor.tags.and(TAG_LOCATION, location.name()), monitor.withLatency);
                monitor.locations.put(location.name(), current);
            }
            current.up.set(location.status().code());
            if (current.latency != null) {
                Double latency = latencySeconds(location.status(), location.value());
                if (latency != null) {
                    current.latency.set(latency);
                }
            }
        }

        Iterator<Map.Entry<String, TrackedLocation>> it = monitor.locations.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, TrackedLocation> entry = it.next();
            if (!seen.contains(entry.getKey())) {
                entry.getValue().remove(registry);
                it.remove();
            }
        }
    }

    /**
     * Latency to publish for one poll, or {@code null} to keep the previous one.
     * Only an explicit DOWN maps to +Inf.
     */
    static Double latencySeconds(MonitorStatus status, Double millis) {
        if (status == MonitorStatus.DOWN) {
            return Double.POSITIVE_INFINITY;
        }
        if (millis == null || status == MonitorStatus.UNKNOWN) {
            return null;
        }
        return millis / 1000.0;
    }

    private TrackedMonitor register(String id, String name, Tags tags, boolean withLatency, TrackedMonitor previous) {
        TrackedMonitor monitor = new TrackedMonitor(registry, name, tags, withLatency);
        if (previous != null) {
            monitor.up.set(previous.up.get());
            monitor.unavailable.set(previous.unavailable.get());
            if (withLatency && previous.withLatency) {
                monitor.latency.set(previous.latency.get());
            }
            // locations are keyed by name, relabel them with the new monitor labels
            for (Map.Entry<String, TrackedLocation> entry : previous.locations.entrySet()) {
                TrackedLocation relabeled = new TrackedLocation(registry, tags.and(TAG_LOCATION, entry.getKey()), withLatency);
                relabeled.up.set(entry.getValue().up.get());
                if (relabeled.latency != null && entry.getValue().latency != null) {
                    relabeled.latency.set(entry.getValue().latency.get());
                }
                monitor.locations.put(entry.getKey(), relabeled);
            }
        }
        log.debug("Tracking monitor {} with {}", id, tags);
        return monitor;
    }

    private static Tags baseTags(Monitor monitor, String groupLabel) {
        return Tags.of(
                TAG_ID, monitor.id(),
                TAG_NAME, monitor.name(),
                TAG_TYPE, monitor.typeLabel(),
                TAG_GROUP, groupLabel);
    }

    /**
     * Comma-joined, sorted group names per monitor id.
     */
    static Map<String, String> groupLabels(List<MonitorGroup> groups) {
        Map<String, SortedSet<String>> names = new HashMap<>();
        for (MonitorGroup group : groups) {
            for (String monitorId : group.monitorIds()) {
                names.computeIfAbsent(monitorId, k -> new TreeSet<>()).add(group.name());
            }
        }
        Map<String, String> labels = new HashMap<>();
        names.forEach((id, set) -> labels.put(id, String.join(",", set)));
        return labels;
    }

    private static Gauge gauge(MeterRegistry registry, String name, String unit, String description,
                               Tags tags, GaugeValue value) {
        return Gauge.builder(name, value, GaugeValue::get)
                .tags(tags)
                .baseUnit(unit)
                .description(description)
                .strongReference(true)
                .register(registry);
    }

    private static final class TrackedMonitor {
        final String name;
        final Tags tags;
        final boolean withLatency;
        final GaugeValue up = new GaugeValue(MonitorStatus.UNKNOWN.code());
        final GaugeValue latency = new GaugeValue(Double.NaN);
        final GaugeValue unavailable = new GaugeValue(0);
        final List<Meter> meters = new ArrayList<>();
        final Map<String, TrackedLocation> locations = new LinkedHashMap<>();

        TrackedMonitor(MeterRegistry registry, String name, Tags tags, boolean withLatency) {
            this.name = name;
            this.tags = tags;
            this.withLatency = withLatency;
            meters.add(gauge(registry, MONITOR_UP, null,
                    "Site24x7 status code of the monitor (1 up, 0 down, -1 unavailable)", tags, up));
            meters.add(gauge(registry, MONITOR_UNAVAILABLE, null,
                    "1 when the latest poll of the monitor produced no usable value", tags, unavailable));
            if (withLatency) {
                meters.add(gauge(registry, MONITOR_LATENCY, "seconds",
                        "Latest response time of the monitor, +Inf when down", tags, latency));
            }
        }

        void remove(MeterRegistry registry) {
            meters.forEach(registry::remove);
            locations.values().forEach(location -> location.remove(registry));
        }
    }

    private static final class TrackedLocation {
        final GaugeValue up = new GaugeValue(MonitorStatus.UNKNOWN.code());
        final GaugeValue latency;
        final List<Meter> meters = new ArrayList<>();

        TrackedLocation(MeterRegistry registry, Tags tags, boolean withLatency) {
            meters.add(gauge(registry, LOCATION_UP, null,
                    "Site24x7 status code of the monitor at one location", tags, up));
            if (withLatency) {
                latency = new GaugeValue(Double.NaN);
                meters.add(gauge(registry, LOCATION_LATENCY, "seconds",
                        "Latest response time of the monitor at one location, +Inf when down", tags, latency));
            } else {
                latency = null;
            }
        }

        void remove(MeterRegistry registry) {
            meters.forEach(registry::remove);
        }
    }
}
