package io.s24x7.exporter.client.model;

/**
 * Status codes as reported by Site24x7.
 */
public enum MonitorStatus {
    DOWN(0),
    UP(1),
    TROUBLE(2),
    CRITICAL(3),
    SUSPENDED(5),
    MAINTENANCE(7),
    DISCOVERY(9),
    CONFIGURATION_ERROR(10),
    /** Code not known to this exporter, or no usable status in the latest poll. */
    UNKNOWN(-1);

    private final int code;

    MonitorStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static MonitorStatus fromCode(int code) {
        for (MonitorStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
