package com.di.segmerge.table;

import java.util.Collections;
import java.util.List;

/**
 * Relational primitives the segment engines are built from.
 *
 * <p>The engines only ever talk to this interface, so a columnar or off-heap backend can be
 * swapped in without touching the interval algorithms. Implementations must return new tables
 * and leave their inputs untouched.
 */
public interface TabularStore {

    /**
     * Stable sort on several columns. Missing values sort last regardless of direction.
     *
     * @param ascending one flag per column
     */
    SegmentTable sort(SegmentTable table, List<String> columns, List<Boolean> ascending);

    /** Stable ascending sort. */
    default SegmentTable sort(SegmentTable table, List<String> columns) {
        return sort(table, columns, Collections.nCopies(columns.size(), Boolean.TRUE));
    }

    /**
     * Equi-join. Output rows follow the left table's order, each left row followed by its
     * matches in right order; unmatched right rows (for RIGHT and OUTER) come last.
     *
     * <p>When a left key and its right key share a name the column appears once. Any other
     * column present on both sides is suffixed; an empty suffix keeps the name.
     */
    SegmentTable equiJoin(SegmentTable left, SegmentTable right,
                          List<String> leftOn, List<String> rightOn,
                          JoinType how, String leftSuffix, String rightSuffix);

    /** Equi-join on identically named key columns with {@code _x} / {@code _y} suffixes. */
    default SegmentTable equiJoin(SegmentTable left, SegmentTable right, List<String> on, JoinType how) {
        return equiJoin(left, right, on, on, how, "_x", "_y");
    }

    /**
     * One row per distinct combination of {@code byColumns}, in order of first appearance,
     * holding the aggregate of {@code aggregateColumn} under the same column name.
     * Missing values are ignored by every operation.
     */
    SegmentTable groupAggregate(SegmentTable table, List<String> byColumns,
                                String aggregateColumn, AggregateOp op);

    /**
     * Replaces missing values with the nearest earlier present value of the same column,
     * following the current row order. With partition columns, values never cross a change
     * of partition.
     */
    SegmentTable forwardFill(SegmentTable table, List<String> columns, List<String> partitionColumns);

    default SegmentTable forwardFill(SegmentTable table, List<String> columns) {
        return forwardFill(table, columns, List.of());
    }

    /** Mirror of {@link #forwardFill(SegmentTable, List, List)} using the nearest later value. */
    SegmentTable backwardFill(SegmentTable table, List<String> columns, List<String> partitionColumns);

    default SegmentTable backwardFill(SegmentTable table, List<String> columns) {
        return backwardFill(table, columns, List.of());
    }

    /**
     * Stacks tables. The result has the union of their columns, in order of first
     * appearance; cells of columns a table lacks are missing.
     */
    SegmentTable concat(List<SegmentTable> tables);

    /** Keeps the first row of every group of rows equal on {@code subset} (all columns when empty). */
    SegmentTable dropDuplicates(SegmentTable table, List<String> subset);

    default SegmentTable dropDuplicates(SegmentTable table) {
        return dropDuplicates(table, List.of());
    }

    /** Projection in the given column order. */
    SegmentTable selectColumns(SegmentTable table, List<String> columns);

    /** Removes the given columns; unknown names are ignored. */
    SegmentTable dropColumns(SegmentTable table, List<String> columns);

    /** Renames columns pairwise. */
    SegmentTable renameColumns(SegmentTable table, List<String> from, List<String> to);

    /** Converts every present value of the column; missing values stay missing. */
    SegmentTable castColumnType(SegmentTable table, String column, ColumnType type);
}
