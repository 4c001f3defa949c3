package org.geoflow.geometry.table;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongList;
import it.unimi.dsi.fastutil.longs.LongLists;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable attribute table keyed by a stable {@code long} row index.
 *
 * <p>Columns are ordered and uniquely named. Row indexes are unique. Cells are
 * nullable, {@code null} being the missing-value marker.</p>
 * <p>Index and column lookups are backed by fastutil maps so row alignment does not
 * box indexes. The table is safe for concurrent reads.</p>
 */
public final class FeatureTable {
    private static final int ABSENT = -1;

    private final List<String> columns;
    private final Object2IntOpenHashMap<String> columnPositions;
    private final LongArrayList index;
    private final Long2IntOpenHashMap rowPositions;
    // row-major, each row has columns.size() cells
    private final Object[][] rows;

    private FeatureTable(List<String> columns, LongArrayList index, Object[][] rows) {
        this.columns = List.copyOf(columns);
        this.columnPositions = new Object2IntOpenHashMap<>(columns.size());
        this.columnPositions.defaultReturnValue(ABSENT);
        for (int i = 0; i < this.columns.size(); i++) {
            if (columnPositions.put(this.columns.get(i), i) != ABSENT) {
                throw new IllegalArgumentException("Duplicate column name: " + this.columns.get(i));
            }
        }

        this.index = index;
        this.rowPositions = new Long2IntOpenHashMap(index.size());
        this.rowPositions.defaultReturnValue(ABSENT);
        for (int i = 0; i < index.size(); i++) {
            if (rowPositions.put(index.getLong(i), i) != ABSENT) {
                throw new IllegalArgumentException("Duplicate row index: " + index.getLong(i));
            }
        }
        this.rows = rows;
        this.columnPositions.trim();
        this.rowPositions.trim();
    }

    /**
     * Starts a table with the given ordered column names.
     */
    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    /**
     * Returns a table with the given columns and no rows.
     */
    public static FeatureTable empty(List<String> columns) {
        return builder(columns).build();
    }

    /**
     * Ordered, immutable column names.
     */
    public List<String> columns() {
        return columns;
    }

    /**
     * Column names as an insertion-ordered set.
     */
    public Set<String> columnSet() {
        return new LinkedHashSet<>(columns);
    }

    public int columnCount() {
        return columns.size();
    }

    /**
     * Row indexes in row order, unmodifiable.
     */
    public LongList index() {
        return LongLists.unmodifiable(index);
    }

    public int rowCount() {
        return index.size();
    }

    public boolean isEmpty() {
        return index.isEmpty();
    }

    public boolean contains(long rowIndex) {
        return rowPositions.containsKey(rowIndex);
    }

    public boolean hasColumn(String column) {
        return columnPositions.containsKey(column);
    }

    /**
     * Returns the cell at {@code (rowIndex, column)}, which may be {@code null}.
     *
     * @throws IllegalArgumentException when the row index or column is unknown.
     */
    public Object get(long rowIndex, String column) {
        int columnPosition = columnPositions.getInt(column);
        if (columnPosition == ABSENT) {
            throw new IllegalArgumentException("Unknown column: " + column);
        }
        return rows[requireRow(rowIndex)][columnPosition];
    }

    /**
     * Returns a copy of the cells of one row in column order.
     *
     * @throws IllegalArgumentException when the row index is unknown.
     */
    public Object[] row(long rowIndex) {
        return rows[requireRow(rowIndex)].clone();
    }

    /**
     * Row position of an index value, or {@code -1} when absent.
     */
    int position(long rowIndex) {
        return rowPositions.get(rowIndex);
    }

    /**
     * Copies the cells of the row at {@code position} into {@code target}.
     */
    void copyRow(int position, Object[] target, int targetOffset) {
        Object[] row = rows[position];
        System.arraycopy(row, 0, target, targetOffset, row.length);
    }

    private int requireRow(long rowIndex) {
        int position = rowPositions.get(rowIndex);
        if (position == ABSENT) {
            throw new IllegalArgumentException("Unknown row index: " + rowIndex);
        }
        return position;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FeatureTable)) {
            return false;
        }
        FeatureTable other = (FeatureTable) o;
        return columns.equals(other.columns)
                && index.equals(other.index)
                && Arrays.deepEquals(rows, other.rows);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, index, Arrays.deepHashCode(rows));
    }

    @Override
    public String toString() {
        return "FeatureTable(columns=" + columns + ", rows=" + index.size() + ")";
    }

    /**
     * Row-at-a-time table builder. Validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final List<String> columns;
        private final LongArrayList index = new LongArrayList();
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            Objects.requireNonNull(columns, "columns");
            for (String column : columns) {
                Objects.requireNonNull(column, "column");
            }
            this.columns = List.copyOf(columns);
        }

        /**
         * Appends one row. The number of values must match the column count.
         */
        public Builder row(long rowIndex, Object... values) {
            Object[] cells = values == null ? new Object[]{null} : values;
            if (cells.length != columns.size()) {
                throw new IllegalArgumentException(
                        "Row " + rowIndex + " has " + cells.length
                                + " values, expected " + columns.size());
            }
            index.add(rowIndex);
            rows.add(cells.clone());
            return this;
        }

        public FeatureTable build() {
            return new FeatureTable(columns, new LongArrayList(index), rows.toArray(new Object[0][]));
        }
    }
}
