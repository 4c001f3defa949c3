package org.geoflow.geometry.merge;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration of one merge block.
 */
@Value
@Builder(toBuilder = true)
public class MergeSettings {

    /**
     * Row-reconciliation discipline. Defaults to {@link JoinKind#INNER}.
     */
    @Builder.Default
    JoinKind joinKind = JoinKind.INNER;

    /**
     * Suffixes for overlapping column names. Defaults to {@link Suffixes#DEFAULT}.
     */
    @Builder.Default
    Suffixes suffixes = Suffixes.DEFAULT;

    /**
     * Returns {@code INNER} with default suffixes.
     */
    public static MergeSettings defaults() {
        return MergeSettings.builder().build();
    }

    /**
     * Returns the given join kind with default suffixes.
     */
    public static MergeSettings of(JoinKind joinKind) {
        return MergeSettings.builder()
                .joinKind(joinKind)
                .build();
    }
}
