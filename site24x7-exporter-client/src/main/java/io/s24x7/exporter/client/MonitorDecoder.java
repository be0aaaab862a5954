package io.s24x7.exporter.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.s24x7.exporter.client.model.Monitor;
import io.s24x7.exporter.client.model.MonitorGroup;
import io.s24x7.exporter.client.model.MonitorLocation;
import io.s24x7.exporter.client.model.MonitorStatus;
import io.s24x7.exporter.client.model.MonitorType;
import io.s24x7.exporter.client.model.Tag;

import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decodes single monitor and monitor group entries from Site24x7 JSON.
 *
 * Unknown members are ignored. Every problem with one entry is reported as a
 * {@link DecodeException} so the caller can skip that entry and keep the rest of the batch.
 */
public class MonitorDecoder {

    /**
     * Site24x7 sends an RFC 3339-ish timestamp with a colon-less offset, e.g. {@code 2021-01-06T18:53:07+0000}.
     */
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss[.SSS]Z");

    public Monitor decodeMonitor(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new DecodeException("monitor entry is not an object");
        }
        String id = requiredText(node, "monitor_id");
        String name = requiredText(node, "name");
        String typeName = node.path("monitor_type").asText("");
        MonitorType type = MonitorType.fromApiName(typeName);

        MonitorStatus status = status(node, "status", null);
        Double value = type.hasPerformanceValue() ? attributeValue(node.get("attribute_value")) : null;

        List<MonitorLocation> locations = new ArrayList<>();
        JsonNode locationsNode = node.path("locations");
        if (!locationsNode.isMissingNode() && !locationsNode.isNull()) {
            if (!locationsNode.isArray()) {
                throw new DecodeException("'locations' is not an array");
            }
            for (JsonNode location : locationsNode) {
                locations.add(decodeLocation(location, type));
            }
        }

        List<Tag> tags = new ArrayList<>();
        for (JsonNode tag : node.path("tags")) {
            if (tag.isTextual()) {
                tags.add(Tag.parse(tag.asText()));
            }
        }

        return new Monitor(id, name, typeName, type, status, value, locations, tags,
                timestamp(node, "last_polled_time"), true);
    }

    /**
     * Decode one entry of {@code /monitor_groups}.
     */
    public MonitorGroup decodeGroup(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new DecodeException("monitor group entry is not an object");
        }
        String id = requiredText(node, "group_id");
        String name = node.hasNonNull("display_name") ? node.get("display_name").asText() : requiredText(node, "group_name");
        Set<String> members = new LinkedHashSet<>();
        for (JsonNode member : node.path("monitors")) {
            if (member.isTextual() || member.isNumber()) {
                members.add(member.asText());
            } else if (member.isObject() && member.hasNonNull("monitor_id")) {
                members.add(member.get("monitor_id").asText());
            }
        }
        return new MonitorGroup(id, name, members);
    }

    private MonitorLocation decodeLocation(JsonNode node, MonitorType type) {
        if (!node.isObject()) {
            throw new DecodeException("location entry is not an object");
        }
        String name = requiredText(node, "location_name");
        // very recent monitors report locations without status until their first poll
        MonitorStatus status = status(node, "status", MonitorStatus.CONFIGURATION_ERROR);
        Double value = type.hasPerformanceValue() ? attributeValue(node.get("attribute_value")) : null;
        return new MonitorLocation(name, status, value, timestamp(node, "last_polled_time"));
    }

    private static String requiredText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new DecodeException("missing field '" + field + "'");
        }
        if (!value.isTextual() && !value.isNumber()) {
            throw new DecodeException("field '" + field + "' is not a string");
        }
        return value.asText();
    }

    private static MonitorStatus status(JsonNode node, String field, MonitorStatus defaultStatus) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            if (defaultStatus == null) {
                throw new DecodeException("missing field '" + field + "'");
            }
            return defaultStatus;
        }
        if (!value.isIntegralNumber()) {
            throw new DecodeException("field '" + field + "' is not an integer: " + value);
        }
        return MonitorStatus.fromCode(value.asInt());
    }

    /**
     * Site24x7 sends {@code "-"} instead of a number when no measurement is possible
     * (typically for down monitors); anything that is not a number means "no value".
     */
    static Double attributeValue(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.asDouble();
        }
        if (value.isTextual()) {
            try {
                double parsed = Double.parseDouble(value.asText().trim());
                return Double.isFinite(parsed) ? parsed : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static OffsetDateTime timestamp(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.asText(), DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new DecodeException("field '" + field + "' has unexpected date format: " + value.asText(), e);
        }
    }
}
