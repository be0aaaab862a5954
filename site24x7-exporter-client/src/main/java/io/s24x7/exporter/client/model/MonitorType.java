package io.s24x7.exporter.client.model;

import java.util.Locale;

/**
 * Supported Site24x7 monitor types and the performance value each one reports.
 */
public enum MonitorType {
    URL("URL", Performance.RESPONSE_TIME_MILLIS),
    HOMEPAGE("HOMEPAGE", Performance.RESPONSE_TIME_MILLIS),
    REALBROWSER("REALBROWSER", Performance.RESPONSE_TIME_MILLIS),
    RESTAPI("RESTAPI", Performance.RESPONSE_TIME_MILLIS),
    PING("PING", Performance.RESPONSE_TIME_MILLIS),
    PORT("PORT", Performance.RESPONSE_TIME_MILLIS),
    DNS("DNS", Performance.RESPONSE_TIME_MILLIS),
    SSL_CERT("SSL_CERT", Performance.NONE),
    HEARTBEAT("HEARTBEAT", Performance.NONE),
    SERVER("SERVER", Performance.NONE),
    UNKNOWN("UNKNOWN", Performance.NONE);

    public enum Performance {
        /** {@code attribute_value} is a response time in milliseconds. */
        RESPONSE_TIME_MILLIS,
        /** Status only. */
        NONE
    }

    private final String apiName;
    private final Performance performance;

    MonitorType(String apiName, Performance performance) {
        this.apiName = apiName;
        this.performance = performance;
    }

    public String apiName() {
        return apiName;
    }

    public Performance performance() {
        return performance;
    }

    public boolean hasPerformanceValue() {
        return performance != Performance.NONE;
    }

    public static MonitorType fromApiName(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT);
        for (MonitorType type : values()) {
            if (type != UNKNOWN && type.apiName.equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
