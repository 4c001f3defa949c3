package org.geoflow.geometry.request;

import lombok.Value;
import org.geoflow.geometry.extent.Extent;

import java.util.Objects;
import java.util.Optional;

/**
 * Response for {@link RequestMode#EXTENT}.
 *
 * <p>An absent extent means "no features", which is distinct from a valid
 * zero-area box.</p>
 */
@Value
public class ExtentResponse implements GeometryResponse {
    /** Bounding box of the answered features, if any. */
    Optional<Extent> extent;
    /** Projection token, forwarded unchanged. */
    String projection;

    private ExtentResponse(Optional<Extent> extent, String projection) {
        this.extent = extent;
        this.projection = projection;
    }

    public static ExtentResponse of(Extent extent, String projection) {
        return new ExtentResponse(Optional.of(extent), projection);
    }

    public static ExtentResponse absent(String projection) {
        return new ExtentResponse(Optional.empty(), projection);
    }

    public static ExtentResponse of(Optional<Extent> extent, String projection) {
        return new ExtentResponse(Objects.requireNonNull(extent, "extent"), projection);
    }
}
