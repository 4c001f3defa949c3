package org.geoflow.geometry.merge;

import org.geoflow.geometry.request.RequestMode;

import java.util.Objects;

/**
 * Side-channel bundle carried from fan-out into combination.
 *
 * <p>Never sent to an upstream source.</p>
 */
public record MergeParameters(JoinKind joinKind, Suffixes suffixes, RequestMode mode) {

    public MergeParameters {
        Objects.requireNonNull(joinKind, "joinKind");
        Objects.requireNonNull(suffixes, "suffixes");
        Objects.requireNonNull(mode, "mode");
    }
}
