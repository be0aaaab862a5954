package io.s24x7.exporter.client.model;

import java.util.Set;

public record MonitorGroup(String id, String name, Set<String> monitorIds) {

    public MonitorGroup {
        monitorIds = monitorIds == null ? Set.of() : Set.copyOf(monitorIds);
    }

    public boolean contains(String monitorId) {
        return monitorIds.contains(monitorId);
    }
}
