package org.geoflow.geometry.request;

import lombok.Value;
import org.geoflow.geometry.table.FeatureTable;

import java.util.Objects;

/**
 * Response for {@link RequestMode#INTERSECTS} and {@link RequestMode#CENTROID}.
 */
@Value
public class FeatureResponse implements GeometryResponse {
    /** Attribute table keyed by stable row index. */
    FeatureTable features;
    /** Projection token, forwarded unchanged. */
    String projection;

    private FeatureResponse(FeatureTable features, String projection) {
        this.features = Objects.requireNonNull(features, "features");
        this.projection = projection;
    }

    public static FeatureResponse of(FeatureTable features, String projection) {
        return new FeatureResponse(features, projection);
    }
}
