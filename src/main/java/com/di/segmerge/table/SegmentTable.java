package com.di.segmerge.table;

import com.di.segmerge.util.CellValues;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable row-oriented table: an ordered list of named columns and an ordered list of rows.
 *
 * <p>Every transformation returns a new table; a table handed to a caller is never modified
 * afterwards. Row arrays are copied on the way in and on the way out.
 */
public final class SegmentTable {

    private final List<String> columns;
    private final Map<String, Integer> positions;
    private final List<Object[]> rows;

    private SegmentTable(List<String> columns, List<Object[]> rows) {
        this.columns = List.copyOf(columns);
        Map<String, Integer> pos = new HashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (pos.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + this.columns.get(i));
            }
        }
        this.positions = Collections.unmodifiableMap(pos);
        this.rows = rows;
    }

    public static Builder builder(String... columns) {
        return new Builder(Arrays.asList(columns));
    }

    public static Builder builder(List<String> columns) {
        return new Builder(columns);
    }

    /** A table with the given columns and no rows. */
    public static SegmentTable empty(List<String> columns) {
        return new SegmentTable(columns, List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public boolean hasColumn(String column) {
        return positions.containsKey(column);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Position of a column.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public int indexOf(String column) {
        Integer index = positions.get(column);
        if (index == null) {
            throw new IllegalArgumentException("Unknown column '" + column + "', table has " + columns);
        }
        return index;
    }

    public Object get(int row, String column) {
        return rows.get(row)[indexOf(column)];
    }

    public Object get(int row, int column) {
        return rows.get(row)[column];
    }

    /** Copy of the values of one row, in column order. */
    public Object[] rowValues(int row) {
        return rows.get(row).clone();
    }

    /** One row as an insertion-ordered column to value map. */
    public Map<String, Object> row(int row) {
        Object[] values = rows.get(row);
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            out.put(columns.get(i), values[i]);
        }
        return out;
    }

    /** Values of one column, top to bottom. */
    public List<Object> column(String column) {
        int index = indexOf(column);
        List<Object> out = new ArrayList<>(rows.size());
        for (Object[] r : rows) {
            out.add(r[index]);
        }
        return Collections.unmodifiableList(out);
    }

    /** Values of several columns for one row, in the order asked for. */
    public List<Object> values(int row, List<String> columnNames) {
        Object[] r = rows.get(row);
        List<Object> out = new ArrayList<>(columnNames.size());
        for (String c : columnNames) {
            out.add(r[indexOf(c)]);
        }
        return out;
    }

    /** New table with the column appended, or replaced in place when it already exists. */
    public SegmentTable withColumn(String column, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException(String.format(
                    "Column '%s' has %d values for %d rows", column, values.size(), rows.size()));
        }
        Integer existing = positions.get(column);
        List<String> newColumns = new ArrayList<>(columns);
        if (existing == null) {
            newColumns.add(column);
        }
        int target = existing != null ? existing : columns.size();
        List<Object[]> newRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Object[] r = Arrays.copyOf(rows.get(i), newColumns.size());
            r[target] = values.get(i);
            newRows.add(r);
        }
        return new SegmentTable(newColumns, newRows);
    }

    /** Rows whose bit is set, in their current order. */
    public SegmentTable filter(BitSet keep) {
        List<Object[]> kept = new ArrayList<>(keep.cardinality());
        for (int i = keep.nextSetBit(0); i >= 0 && i < rows.size(); i = keep.nextSetBit(i + 1)) {
            kept.add(rows.get(i));
        }
        return new SegmentTable(columns, kept);
    }

    /** Rows at the given positions, in the given order; positions may repeat. */
    public SegmentTable take(int[] order) {
        List<Object[]> taken = new ArrayList<>(order.length);
        for (int i : order) {
            taken.add(rows.get(i));
        }
        return new SegmentTable(columns, taken);
    }

    /** Same rows under a new list of column names of equal width. */
    SegmentTable withColumnNames(List<String> newColumns) {
        if (newColumns.size() != columns.size()) {
            throw new IllegalArgumentException("Expected " + columns.size() + " column names, got " + newColumns);
        }
        return new SegmentTable(newColumns, rows);
    }

    /** Package-level access for the store implementation; arrays must not be mutated. */
    List<Object[]> rawRows() {
        return rows;
    }

    static SegmentTable wrap(List<String> columns, List<Object[]> rows) {
        return new SegmentTable(columns, rows);
    }

    /**
     * Same columns and the same cells row by row, cells compared with
     * {@link CellValues#same(Object, Object)}.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SegmentTable other)) return false;
        if (!columns.equals(other.columns) || rows.size() != other.rows.size()) return false;
        for (int i = 0; i < rows.size(); i++) {
            Object[] a = rows.get(i);
            Object[] b = other.rows.get(i);
            for (int c = 0; c < a.length; c++) {
                if (!CellValues.same(a[c], b[c])) return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        int h = columns.hashCode();
        for (Object[] r : rows) {
            h = 31 * h + CellValues.key(Arrays.asList(r)).hashCode();
        }
        return h;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("SegmentTable").append(columns).append(" (").append(rows.size()).append(" rows)");
        for (Object[] r : rows) {
            sb.append(System.lineSeparator()).append("  ").append(Arrays.toString(r));
        }
        return sb.toString();
    }

    /** Accumulates rows for a new table. */
    public static final class Builder {

        private final List<String> columns;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(List<String> columns) {
            this.columns = List.copyOf(columns);
        }

        /** Adds a row; values are given in column order. */
        public Builder addRow(Object... values) {
            if (values.length != columns.size()) {
                throw new IllegalArgumentException(String.format(
                        "Row has %d values for %d columns %s", values.length, columns.size(), columns));
            }
            rows.add(values.clone());
            return this;
        }

        /** Adds a row from a map; columns absent from the map are left missing. */
        public Builder addRow(Map<String, ?> values) {
            Object[] r = new Object[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                r[i] = values.get(columns.get(i));
            }
            rows.add(r);
            return this;
        }

        public SegmentTable build() {
            return new SegmentTable(columns, new ArrayList<>(rows));
        }
    }
}
