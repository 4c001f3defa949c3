package org.geoflow.geometry.block;

import org.geoflow.geometry.request.GeometryRequest;

import java.util.Objects;

/**
 * One upstream ask: a source and the request it should answer.
 */
public record SourceRequest(GeometrySource source, GeometryRequest request) {

    public SourceRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(request, "request");
    }
}
