package org.geoflow.geometry.extent;

import java.util.Optional;

/**
 * Immutable axis-aligned bounding box in {@code (minX, minY, maxX, maxY)} order.
 *
 * <p>Zero-area boxes (a point or a line segment) are valid extents. The absence of
 * an extent is modeled by callers as {@link Optional#empty()}, never as a box.</p>
 */
public record Extent(double minX, double minY, double maxX, double maxY) {

    public Extent {
        requireFinite(minX, "minX");
        requireFinite(minY, "minY");
        requireFinite(maxX, "maxX");
        requireFinite(maxY, "maxY");
        if (minX > maxX) {
            throw new IllegalArgumentException("minX must be <= maxX: " + minX + " > " + maxX);
        }
        if (minY > maxY) {
            throw new IllegalArgumentException("minY must be <= maxY: " + minY + " > " + maxY);
        }
    }

    /**
     * Creates an extent from a {@code (minx, miny, maxx, maxy)} array.
     */
    public static Extent of(double... bounds) {
        if (bounds == null || bounds.length != 4) {
            throw new IllegalArgumentException("extent requires exactly 4 bounds (minx, miny, maxx, maxy)");
        }
        return new Extent(bounds[0], bounds[1], bounds[2], bounds[3]);
    }

    /**
     * Returns the overlap of two boxes, treating both as closed.
     *
     * <p>Boxes that only touch along an edge or corner overlap in a zero-area extent.
     * Strictly disjoint boxes have no intersection.</p>
     */
    public Optional<Extent> intersection(Extent other) {
        double lowX = Math.max(minX, other.minX);
        double lowY = Math.max(minY, other.minY);
        double highX = Math.min(maxX, other.maxX);
        double highY = Math.min(maxY, other.maxY);
        if (lowX > highX || lowY > highY) {
            return Optional.empty();
        }
        return Optional.of(new Extent(lowX, lowY, highX, highY));
    }

    /**
     * Returns the smallest box covering both boxes.
     */
    public Extent union(Extent other) {
        return new Extent(
                Math.min(minX, other.minX),
                Math.min(minY, other.minY),
                Math.max(maxX, other.maxX),
                Math.max(maxY, other.maxY)
        );
    }

    public double width() {
        return maxX - minX;
    }

    public double height() {
        return maxY - minY;
    }

    /**
     * Returns true for point and segment boxes.
     */
    public boolean zeroArea() {
        return width() == 0.0d || height() == 0.0d;
    }

    public double[] toArray() {
        return new double[]{minX, minY, maxX, maxY};
    }

    private static void requireFinite(double value, String fieldName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(fieldName + " must be finite");
        }
    }
}
