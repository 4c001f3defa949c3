package org.geoflow.geometry.testutil;

import org.geoflow.geometry.block.GeometrySource;
import org.geoflow.geometry.block.InMemoryGeometrySource;
import org.geoflow.geometry.extent.Extent;
import org.geoflow.geometry.request.GeometryRequest;
import org.geoflow.geometry.request.GeometryResponse;
import org.geoflow.geometry.table.FeatureTable;

import java.util.List;
import java.util.Set;

/**
 * Shared feature tables and sources for geometry block tests.
 */
public final class GeometryFixtures {
    public static final String RD_NEW = "EPSG:28992";
    public static final String WGS84 = "EPSG:4326";

    private GeometryFixtures() {
    }

    /**
     * Table with columns {@code (name, height)} and one row per index.
     */
    public static FeatureTable heights(long... indexes) {
        FeatureTable.Builder builder = FeatureTable.builder(List.of("name", "height"));
        for (long index : indexes) {
            builder.row(index, "building-" + index, (double) index * 10.0d);
        }
        return builder.build();
    }

    /**
     * Table with columns {@code (name, area)} and one row per index.
     */
    public static FeatureTable areas(long... indexes) {
        FeatureTable.Builder builder = FeatureTable.builder(List.of("name", "area"));
        for (long index : indexes) {
            builder.row(index, "parcel-" + index, (double) index * 100.0d);
        }
        return builder.build();
    }

    public static InMemoryGeometrySource source(FeatureTable table, Extent extent, String projection) {
        return InMemoryGeometrySource.builder()
                .features(table)
                .extent(extent)
                .projection(projection)
                .build();
    }

    public static InMemoryGeometrySource source(FeatureTable table) {
        return source(table, null, RD_NEW);
    }

    public static InMemoryGeometrySource extentSource(Extent extent, String projection) {
        return source(FeatureTable.empty(List.of("name")), extent, projection);
    }

    /**
     * Source declaring the given columns and failing every request with {@code failure}.
     */
    public static GeometrySource failingSource(Set<String> columns, RuntimeException failure) {
        return new GeometrySource() {
            @Override
            public Set<String> columns() {
                return columns;
            }

            @Override
            public GeometryResponse getData(GeometryRequest request) {
                throw failure;
            }
        };
    }

    /**
     * Source declaring the given columns that must never be evaluated.
     */
    public static GeometrySource columnsOnly(Set<String> columns) {
        return failingSource(columns, new IllegalStateException("columns-only source was evaluated"));
    }
}
