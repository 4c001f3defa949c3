package org.geoflow.geometry.block;

import lombok.Builder;
import org.geoflow.geometry.extent.Extent;
import org.geoflow.geometry.request.ExtentResponse;
import org.geoflow.geometry.request.FeatureResponse;
import org.geoflow.geometry.request.GeometryRequest;
import org.geoflow.geometry.request.GeometryResponse;
import org.geoflow.geometry.table.FeatureTable;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Leaf source answering every request from a fixed feature table and extent.
 *
 * <p>Requests are recorded as received, which lets callers inspect what a pipeline
 * asked of its leaves. Safe for concurrent evaluation.</p>
 */
public final class InMemoryGeometrySource implements GeometrySource {
    private final FeatureTable features;
    private final Extent extent;
    private final String projection;
    private final List<GeometryRequest> receivedRequests = new CopyOnWriteArrayList<>();

    /**
     * @param features table returned for feature modes.
     * @param extent extent returned for extent mode; {@code null} means no extent.
     * @param projection projection token echoed in every response.
     */
    @Builder
    public InMemoryGeometrySource(FeatureTable features, Extent extent, String projection) {
        this.features = Objects.requireNonNull(features, "features");
        this.extent = extent;
        this.projection = projection;
    }

    @Override
    public Set<String> columns() {
        return features.columnSet();
    }

    @Override
    public GeometryResponse getData(GeometryRequest request) {
        receivedRequests.add(Objects.requireNonNull(request, "request"));
        return switch (request.getMode()) {
            case INTERSECTS, CENTROID -> FeatureResponse.of(features, projection);
            case EXTENT -> ExtentResponse.of(Optional.ofNullable(extent), projection);
        };
    }

    /**
     * Requests received so far, in arrival order.
     */
    public List<GeometryRequest> receivedRequests() {
        return List.copyOf(receivedRequests);
    }
}
