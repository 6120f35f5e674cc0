package com.di.segmerge.util;

import com.di.segmerge.exception.SchemaException;
import com.di.segmerge.table.JoinType;
import com.di.segmerge.table.SegmentLayout;
import com.di.segmerge.table.SegmentTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Argument checks run before any segment operation touches its inputs.
 * Failures are reported as {@link SchemaException} so nothing is ever partially computed.
 */
@Slf4j
public final class ArgumentValidator {

    private ArgumentValidator() {}

    // ============================================================================
    // Generic checks
    // ============================================================================

    /**
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(String.format("%s cannot be null", name));
        }
        return value;
    }

    // ============================================================================
    // Merge arguments
    // ============================================================================

    /**
     * Validates the arguments of a two-table interval merge and resolves the join kind.
     *
     * <p>Each requested column must exist in at least one of the two tables; a discrete
     * column present on one side only is broadcast later.
     *
     * @return the parsed join kind
     * @throws SchemaException if a column is missing from both tables, the continuous
     *                         index is not two columns wide, or {@code how} is unknown
     */
    public static JoinType validateMergeArguments(SegmentTable left, SegmentTable right,
                                                  List<String> discrete, List<String> continuous,
                                                  String how) {
        requireNonNull(left, "Left table");
        requireNonNull(right, "Right table");
        requireNonNull(discrete, "Discrete columns");
        requireNonNull(continuous, "Continuous columns");

        List<String> requested = new ArrayList<>(continuous);
        requested.addAll(discrete);
        for (String c : requested) {
            if (!(left.hasColumn(c) || right.hasColumn(c))) {
                log.warn("[VALIDATE] column '{}' absent from left {} and right {}", c, left.columns(), right.columns());
                throw new SchemaException(String.format("%s is not in columns", c));
            }
        }
        if (continuous.size() != 2) {
            throw new SchemaException("Only two continuous index is possible, got " + continuous);
        }
        return JoinType.fromName(how);
    }

    // ============================================================================
    // Single-table arguments
    // ============================================================================

    /**
     * Checks that the table carries every column of the layout.
     *
     * @throws SchemaException naming the missing columns
     */
    public static void validateTable(SegmentTable table, SegmentLayout layout, String tableName) {
        requireNonNull(table, tableName);
        requireNonNull(layout, "Layout");
        layout.requireColumns(table, tableName);
    }

    /**
     * Validates a resampling bin length.
     *
     * @throws SchemaException if the length is negative or not finite
     */
    public static double validateLength(double length) {
        if (Double.isNaN(length) || Double.isInfinite(length) || length < 0) {
            throw new SchemaException("Segment length must be a finite value >= 0, got " + length);
        }
        return length;
    }

    /**
     * Validates an optional continuity limit.
     *
     * @throws SchemaException if the limit is not strictly positive
     */
    public static Double validateLimit(Double limit) {
        if (limit != null && (limit.isNaN() || limit <= 0)) {
            throw new SchemaException("Continuity limit must be > 0 when set, got " + limit);
        }
        return limit;
    }
}
