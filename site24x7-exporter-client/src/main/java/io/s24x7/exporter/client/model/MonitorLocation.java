package io.s24x7.exporter.client.model;

import java.time.OffsetDateTime;

/**
 * Result of the latest poll from one Site24x7 location.
 *
 * @param value performance value in the unit of the monitor type, or {@code null} when the
 *              poll carried none
 */
public record MonitorLocation(String name, MonitorStatus status, Double value, OffsetDateTime lastPolledTime) {

    public boolean hasValue() {
        return value != null;
    }
}
