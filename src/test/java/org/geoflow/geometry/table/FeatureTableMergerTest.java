package org.geoflow.geometry.table;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.geoflow.core.TypeConstraintException;
import org.geoflow.geometry.merge.JoinKind;
import org.geoflow.geometry.merge.Suffixes;
import org.geoflow.geometry.testutil.GeometryFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FeatureTableMerger Tests")
class FeatureTableMergerTest {

    private static final FeatureTable LEFT = GeometryFixtures.heights(5, 1, 3);
    private static final FeatureTable RIGHT = GeometryFixtures.areas(3, 4, 1);

    private static LongArrayList indexOf(long... values) {
        return LongArrayList.wrap(values);
    }

    @Nested
    @DisplayName("Row semantics")
    class RowSemantics {

        @Test
        @DisplayName("LEFT keeps every left row in left order")
        void testLeftJoin() {
            FeatureTable merged = FeatureTableMerger.merge(LEFT, RIGHT, JoinKind.LEFT, Suffixes.DEFAULT);
            assertEquals(indexOf(5, 1, 3), merged.index());
            assertNull(merged.get(5, "area"));
            assertNull(merged.get(5, "name_right"));
            assertEquals(100.0d, merged.get(1, "area"));
        }

        @Test
        @DisplayName("RIGHT keeps every right row in right order")
        void testRightJoin() {
            FeatureTable merged = FeatureTableMerger.merge(LEFT, RIGHT, JoinKind.RIGHT, Suffixes.DEFAULT);
            assertEquals(indexOf(3, 4, 1), merged.index());
            assertNull(merged.get(4, "name"));
            assertNull(merged.get(4, "height"));
            assertEquals("parcel-4", merged.get(4, "name_right"));
        }

        @Test
        @DisplayName("INNER keeps shared rows in left order")
        void testInnerJoin() {
            FeatureTable merged = FeatureTableMerger.merge(LEFT, RIGHT, JoinKind.INNER, Suffixes.DEFAULT);
            assertEquals(indexOf(1, 3), merged.index());
        }

        @Test
        @DisplayName("OUTER keeps the sorted union of both indexes")
        void testOuterJoin() {
            FeatureTable merged = FeatureTableMerger.merge(LEFT, RIGHT, JoinKind.OUTER, Suffixes.DEFAULT);
            assertEquals(indexOf(1, 3, 4, 5), merged.index());
            assertNull(merged.get(4, "height"));
            assertNull(merged.get(5, "area"));
        }

        @Test
        @DisplayName("INNER of disjoint indexes is empty but keeps merged columns")
        void testInnerDisjoint() {
            FeatureTable merged = FeatureTableMerger.merge(
                    GeometryFixtures.heights(1, 2),
                    GeometryFixtures.areas(3, 4),
                    JoinKind.INNER,
                    Suffixes.DEFAULT
            );
            assertTrue(merged.isEmpty());
            assertEquals(List.of("name", "height", "name_right", "area"), merged.columns());
        }

        @Test
        @DisplayName("Empty side behaves as an empty index set")
        void testEmptySide() {
            FeatureTable empty = FeatureTable.empty(List.of("name", "area"));
            assertEquals(indexOf(1, 3, 5),
                    FeatureTableMerger.merge(LEFT, empty, JoinKind.OUTER, Suffixes.DEFAULT).index());
            assertEquals(indexOf(5, 1, 3),
                    FeatureTableMerger.merge(LEFT, empty, JoinKind.LEFT, Suffixes.DEFAULT).index());
            assertTrue(FeatureTableMerger.merge(LEFT, empty, JoinKind.INNER, Suffixes.DEFAULT).isEmpty());
            assertTrue(FeatureTableMerger.merge(LEFT, empty, JoinKind.RIGHT, Suffixes.DEFAULT).isEmpty());
        }
    }

    @Nested
    @DisplayName("Columns and cells")
    class ColumnsAndCells {

        @Test
        @DisplayName("Shared columns are suffixed, cells stay aligned by index")
        void testSuffixedColumns() {
            FeatureTable merged = FeatureTableMerger.merge(LEFT, RIGHT, JoinKind.INNER, Suffixes.of("_l", "_r"));
            assertEquals(List.of("name_l", "height", "name_r", "area"), merged.columns());
            assertArrayEquals(new Object[]{"building-3", 30.0d, "parcel-3", 300.0d}, merged.row(3));
        }

        @Test
        @DisplayName("Colliding suffixed names fail the merge")
        void testCollisionFails() {
            FeatureTable left = FeatureTable.builder(List.of("a", "a_right")).row(1, 1, 2).build();
            FeatureTable right = FeatureTable.builder(List.of("a")).row(1, 3).build();
            TypeConstraintException ex = assertThrows(
                    TypeConstraintException.class,
                    () -> FeatureTableMerger.merge(left, right, JoinKind.INNER, Suffixes.DEFAULT)
            );
            assertEquals(ColumnSchema.REASON_COLUMN_NAME_COLLISION, ex.reasonCode());
        }

        @Test
        @DisplayName("Inputs are not modified")
        void testInputsUntouched() {
            FeatureTable left = GeometryFixtures.heights(1, 2);
            FeatureTable right = GeometryFixtures.areas(2);
            FeatureTableMerger.merge(left, right, JoinKind.OUTER, Suffixes.DEFAULT);
            assertEquals(GeometryFixtures.heights(1, 2), left);
            assertEquals(GeometryFixtures.areas(2), right);
        }
    }
}
