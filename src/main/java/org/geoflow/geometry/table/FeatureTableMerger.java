package org.geoflow.geometry.table;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongRBTreeSet;
import lombok.experimental.UtilityClass;
import org.geoflow.geometry.merge.JoinKind;
import org.geoflow.geometry.merge.Suffixes;

import java.util.List;
import java.util.Objects;

/**
 * Index-aligned merge of two feature tables.
 *
 * <p>Rows are matched only on equal row index values, never on data columns.
 * Row order of the result:</p>
 * <ul>
 * <li>{@code LEFT} and {@code INNER}: left row order.</li>
 * <li>{@code RIGHT}: right row order.</li>
 * <li>{@code OUTER}: ascending union of both indexes.</li>
 * </ul>
 * <p>Cells of the side a row is missing from are {@code null}.</p>
 */
@UtilityClass
public final class FeatureTableMerger {

    /**
     * Merges {@code left} and {@code right} on their row index.
     *
     * @param left left table.
     * @param right right table.
     * @param joinKind which row indexes survive.
     * @param suffixes suffixes for column names present on both sides.
     * @return merged table; columns follow {@link ColumnSchema}.
     * @throws org.geoflow.core.TypeConstraintException when suffixing leaves duplicate column names.
     */
    public static FeatureTable merge(FeatureTable left, FeatureTable right, JoinKind joinKind, Suffixes suffixes) {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
        Objects.requireNonNull(joinKind, "joinKind");

        List<String> columns = ColumnSchema.requireDistinct(
                ColumnSchema.mergedOrder(left.columns(), right.columns(), suffixes)
        );
        LongList rowIndex = resolveIndex(left, right, joinKind);

        int leftWidth = left.columnCount();
        FeatureTable.Builder builder = FeatureTable.builder(columns);
        for (int i = 0; i < rowIndex.size(); i++) {
            long key = rowIndex.getLong(i);
            Object[] cells = new Object[columns.size()];
            int leftPosition = left.position(key);
            if (leftPosition >= 0) {
                left.copyRow(leftPosition, cells, 0);
            }
            int rightPosition = right.position(key);
            if (rightPosition >= 0) {
                right.copyRow(rightPosition, cells, leftWidth);
            }
            builder.row(key, cells);
        }
        return builder.build();
    }

    /**
     * Resolves surviving row indexes in result order.
     */
    static LongList resolveIndex(FeatureTable left, FeatureTable right, JoinKind joinKind) {
        return switch (joinKind) {
            case LEFT -> new LongArrayList(left.index());
            case RIGHT -> new LongArrayList(right.index());
            case INNER -> intersect(left, right);
            case OUTER -> union(left, right);
        };
    }

    private static LongList intersect(FeatureTable left, FeatureTable right) {
        LongList leftIndex = left.index();
        LongArrayList result = new LongArrayList(Math.min(leftIndex.size(), right.rowCount()));
        for (int i = 0; i < leftIndex.size(); i++) {
            long key = leftIndex.getLong(i);
            if (right.contains(key)) {
                result.add(key);
            }
        }
        return result;
    }

    private static LongList union(FeatureTable left, FeatureTable right) {
        LongRBTreeSet sorted = new LongRBTreeSet(left.index());
        sorted.addAll(right.index());
        return new LongArrayList(sorted);
    }
}
