package org.geoflow.geometry.extent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Extent Tests")
class ExtentTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Bounds array is read in (minx, miny, maxx, maxy) order")
        void testOfArray() {
            Extent extent = Extent.of(1, 2, 3, 4);
            assertEquals(new Extent(1, 2, 3, 4), extent);
            assertArrayEquals(new double[]{1, 2, 3, 4}, extent.toArray());
        }

        @Test
        @DisplayName("Wrong bounds arity is rejected")
        void testWrongArityRejected() {
            assertThrows(IllegalArgumentException.class, () -> Extent.of(1, 2, 3));
            assertThrows(IllegalArgumentException.class, () -> Extent.of((double[]) null));
        }

        @Test
        @DisplayName("Inverted and non-finite bounds are rejected")
        void testInvalidBoundsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new Extent(5, 0, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new Extent(0, 5, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new Extent(Double.NaN, 0, 1, 1));
            assertThrows(IllegalArgumentException.class, () -> new Extent(0, 0, Double.POSITIVE_INFINITY, 1));
        }

        @Test
        @DisplayName("Zero-area boxes are valid extents")
        void testZeroAreaIsValid() {
            Extent point = new Extent(3, 3, 3, 3);
            assertTrue(point.zeroArea());
            assertEquals(0.0d, point.width());
            assertFalse(new Extent(0, 0, 1, 1).zeroArea());
        }
    }

    @Nested
    @DisplayName("Algebra")
    class Algebra {

        @Test
        @DisplayName("Overlapping boxes intersect in their shared region")
        void testOverlappingIntersection() {
            Extent a = new Extent(0, 0, 10, 10);
            Extent b = new Extent(5, 5, 15, 15);
            assertEquals(Optional.of(new Extent(5, 5, 10, 10)), a.intersection(b));
            assertEquals(a.intersection(b), b.intersection(a));
        }

        @Test
        @DisplayName("Disjoint boxes have no intersection")
        void testDisjointIntersectionIsAbsent() {
            Extent a = new Extent(0, 0, 1, 1);
            Extent b = new Extent(10, 10, 11, 11);
            assertTrue(a.intersection(b).isEmpty());
        }

        @Test
        @DisplayName("Boxes disjoint on one axis only have no intersection")
        void testSingleAxisDisjoint() {
            Extent a = new Extent(0, 0, 10, 1);
            Extent b = new Extent(2, 5, 8, 6);
            assertTrue(a.intersection(b).isEmpty());
        }

        @Test
        @DisplayName("Touching boxes intersect in a zero-area extent")
        void testTouchingIntersection() {
            Extent a = new Extent(0, 0, 1, 1);
            Extent b = new Extent(1, 0, 2, 1);
            Extent shared = a.intersection(b).orElseThrow();
            assertEquals(new Extent(1, 0, 1, 1), shared);
            assertTrue(shared.zeroArea());
        }

        @Test
        @DisplayName("Union is the smallest covering box")
        void testUnion() {
            Extent a = new Extent(0, 0, 10, 10);
            Extent b = new Extent(5, 5, 15, 15);
            assertEquals(new Extent(0, 0, 15, 15), a.union(b));
            assertEquals(new Extent(0, 0, 11, 11), new Extent(0, 0, 1, 1).union(new Extent(10, 10, 11, 11)));
        }

        @Test
        @DisplayName("Contained box is its own intersection")
        void testContainedIntersection() {
            Extent outer = new Extent(0, 0, 10, 10);
            Extent inner = new Extent(2, 3, 4, 5);
            assertEquals(Optional.of(inner), outer.intersection(inner));
            assertEquals(outer, outer.union(inner));
        }
    }
}
