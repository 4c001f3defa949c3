package org.geoflow.geometry.block;

import org.geoflow.geometry.request.GeometryRequest;
import org.geoflow.geometry.request.GeometryResponse;

import java.util.Set;

/**
 * Capability of any pipeline node that produces geometry data on request.
 */
public interface GeometrySource {

    /**
     * Declared attribute columns.
     *
     * <p>Must be answerable without evaluating any request, so planning tools can
     * read it on a pipeline that has never run.</p>
     */
    Set<String> columns();

    /**
     * Evaluates one request.
     *
     * @param request request; mode decides the response shape.
     * @return {@link org.geoflow.geometry.request.FeatureResponse} for feature modes,
     *         {@link org.geoflow.geometry.request.ExtentResponse} for extent mode.
     */
    GeometryResponse getData(GeometryRequest request);
}
