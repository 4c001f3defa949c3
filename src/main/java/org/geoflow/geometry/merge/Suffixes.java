package org.geoflow.geometry.merge;

import java.util.Objects;

/**
 * Ordered pair of strings appended to column names present on both sides of a merge.
 */
public record Suffixes(String left, String right) {
    /** {@code ("", "_right")}: left columns keep their name. */
    public static final Suffixes DEFAULT = new Suffixes("", "_right");

    public Suffixes {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    public static Suffixes of(String left, String right) {
        return new Suffixes(left, right);
    }

    /**
     * Returns the same pair in reverse order.
     */
    public Suffixes swapped() {
        return new Suffixes(right, left);
    }

    public String leftName(String column) {
        return column + left;
    }

    public String rightName(String column) {
        return column + right;
    }
}
