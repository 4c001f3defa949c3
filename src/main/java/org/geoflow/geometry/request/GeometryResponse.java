package org.geoflow.geometry.request;

/**
 * Payload a block returns for one request. The concrete shape depends on the mode.
 */
public interface GeometryResponse {

    /**
     * Coordinate reference system token the payload is expressed in.
     */
    String getProjection();
}
