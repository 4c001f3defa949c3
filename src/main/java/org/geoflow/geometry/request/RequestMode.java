package org.geoflow.geometry.request;

import org.geoflow.core.UnsupportedModeException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported request modes.
 *
 * <p>{@code INTERSECTS} and {@code CENTROID} ask for an attribute table of features.</p>
 * <p>{@code EXTENT} asks for the bounding box of the features, or its absence.</p>
 */
public enum RequestMode {
    INTERSECTS,
    CENTROID,
    EXTENT;

    public static final String REASON_UNKNOWN_MODE = "REQUEST_MODE_UNKNOWN";

    private static final List<String> IDS = Arrays.stream(values())
            .map(RequestMode::id)
            .collect(Collectors.toUnmodifiableList());

    /**
     * Lower-case wire id of this mode.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns true when responses for this mode carry a feature table.
     */
    public boolean featureMode() {
        return this != EXTENT;
    }

    /**
     * Parses an exact lower-case mode id. Other spellings are rejected.
     *
     * @throws UnsupportedModeException when the id is not a known mode.
     */
    public static RequestMode fromId(String id) {
        if (id != null) {
            for (RequestMode mode : values()) {
                if (mode.id().equals(id)) {
                    return mode;
                }
            }
        }
        throw new UnsupportedModeException(REASON_UNKNOWN_MODE, id, IDS);
    }
}
