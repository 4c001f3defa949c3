package org.geoflow.core;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Thrown when a mode id (join kind, request mode) is outside the recognized set.
 *
 * <p>The message always lists the accepted ids.</p>
 */
public final class UnsupportedModeException extends GeometryBlockException {

    public UnsupportedModeException(String reasonCode, Object rejected, Collection<String> validIds) {
        super(reasonCode, formatRejection(rejected, validIds));
    }

    private static String formatRejection(Object rejected, Collection<String> validIds) {
        String listed = validIds.stream()
                .map(id -> "'" + id + "'")
                .collect(Collectors.joining(", ", "(", ")"));
        return "'" + rejected + "' is not part of the list of operations: " + listed;
    }
}
