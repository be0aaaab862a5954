package io.s24x7.exporter.client.model;

/**
 * A monitor tag. Site24x7 sends tags as {@code "key:value"} strings.
 */
public record Tag(String key, String value) {

    public static Tag parse(String raw) {
        if (raw == null) {
            return new Tag("", "");
        }
        int separator = raw.indexOf(':');
        if (separator < 0) {
            return new Tag(raw, "");
        }
        return new Tag(raw.substring(0, separator), raw.substring(separator + 1));
    }
}
