package io.s24x7.exporter.server.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Static table of Site24x7 polling locations, read once from {@code geolocations.json}.
 */
public final class GeoLocationTable {

    static final String RESOURCE = "/geolocations.json";

    private final List<GeoLocation> locations;
    private final byte[] json;

    private GeoLocationTable(List<GeoLocation> locations, byte[] json) {
        this.locations = List.copyOf(locations);
        this.json = json;
    }

    public static GeoLocationTable load(ObjectMapper mapper) {
        try (InputStream in = GeoLocationTable.class.getResourceAsStream(RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + RESOURCE);
            }
            List<GeoLocation> locations = mapper.readValue(in, new TypeReference<List<GeoLocation>>() {
            });
            return new GeoLocationTable(locations, mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(locations));
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read " + RESOURCE, e);
        }
    }

    public List<GeoLocation> locations() {
        return locations;
    }

    /**
     * The table as a pretty-printed JSON array.
     */
    byte[] toJson() {
        return json.clone();
    }
}
