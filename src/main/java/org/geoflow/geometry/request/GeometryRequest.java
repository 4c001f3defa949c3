package org.geoflow.geometry.request;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Objects;

/**
 * Top-down description of the data a block should produce.
 *
 * <p>Only {@code mode} is interpreted by combining blocks. Every other parameter
 * (geometry filter, projection, resolution, limits) is opaque and forwarded verbatim
 * to upstream sources.</p>
 */
@Value
@Builder(toBuilder = true)
public class GeometryRequest {
    /** Requested representation. */
    RequestMode mode;
    /** Opaque request parameters keyed by name. */
    @Singular
    Map<String, Object> parameters;

    private GeometryRequest(RequestMode mode, Map<String, Object> parameters) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.parameters = parameters;
    }

    /**
     * Returns a request that carries only the given mode.
     */
    public static GeometryRequest of(RequestMode mode) {
        return builder().mode(mode).build();
    }

    /**
     * Returns one opaque parameter, or {@code null} when absent.
     */
    public Object parameter(String name) {
        return parameters.get(name);
    }
}
