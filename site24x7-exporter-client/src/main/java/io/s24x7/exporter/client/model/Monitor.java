package io.s24x7.exporter.client.model;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * One monitor as decoded from {@code /current_status}.
 *
 * @param typeName raw {@code monitor_type} from the payload, kept for types this exporter
 *                 does not know
 * @param value    performance value in the unit of {@link MonitorType#performance()}, or
 *                 {@code null} when the poll carried none
 * @param decoded  {@code false} for a placeholder standing in for a monitor whose payload
 *                 could not be decoded
 */
public record Monitor(
        String id,
        String name,
        String typeName,
        MonitorType type,
        MonitorStatus status,
        Double value,
        List<MonitorLocation> locations,
        List<Tag> tags,
        OffsetDateTime lastPolledTime,
        boolean decoded
) {

    public Monitor {
        locations = locations == null ? List.of() : List.copyOf(locations);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    /**
     * Placeholder for a monitor that is still listed upstream but whose payload could not be
     * decoded in this poll.
     */
    public static Monitor undecodable(String id, String name, String typeName) {
        return new Monitor(id, name == null ? "" : name, typeName == null ? "" : typeName,
                MonitorType.fromApiName(typeName), MonitorStatus.UNKNOWN, null,
                List.of(), List.of(), null, false);
    }

    public boolean hasValue() {
        return value != null;
    }

    /**
     * Type label as exported; unknown types keep the name Site24x7 sent.
     */
    public String typeLabel() {
        if (type == MonitorType.UNKNOWN && typeName != null && !typeName.isEmpty()) {
            return typeName;
        }
        return type.apiName();
    }
}
