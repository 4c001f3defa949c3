package org.geoflow.geometry.merge;

import org.geoflow.core.UnsupportedModeException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Row-reconciliation discipline of a merge.
 *
 * <p>{@code LEFT} keeps every left row, {@code RIGHT} every right row, {@code INNER}
 * rows present on both sides and {@code OUTER} rows present on either side.</p>
 */
public enum JoinKind {
    LEFT,
    RIGHT,
    INNER,
    OUTER;

    public static final String REASON_UNKNOWN_JOIN_KIND = "MERGE_JOIN_KIND_UNKNOWN";

    private static final List<String> IDS = Arrays.stream(values())
            .map(JoinKind::id)
            .collect(Collectors.toUnmodifiableList());

    /**
     * Lower-case id as used in serialized pipeline graphs.
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the accepted ids in declaration order.
     */
    public static List<String> ids() {
        return IDS;
    }

    /**
     * Parses an exact lower-case join kind id. Other spellings are rejected.
     *
     * @throws UnsupportedModeException when the id is not a known join kind.
     */
    public static JoinKind fromId(String id) {
        if (id != null) {
            for (JoinKind kind : values()) {
                if (kind.id().equals(id)) {
                    return kind;
                }
            }
        }
        throw new UnsupportedModeException(REASON_UNKNOWN_JOIN_KIND, id, IDS);
    }
}
