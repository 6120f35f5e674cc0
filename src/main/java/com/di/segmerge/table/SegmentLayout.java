package com.di.segmerge.table;

import com.di.segmerge.exception.SchemaException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Declares which columns of a table form the discrete key of a track and which two
 * columns hold the half-open {@code [start, end)} bounds of each segment.
 * Every other column is payload and is passed through untouched.
 */
public record SegmentLayout(List<String> discrete, String start, String end) {

    public SegmentLayout {
        Objects.requireNonNull(discrete, "discrete columns cannot be null");
        Objects.requireNonNull(start, "start column cannot be null");
        Objects.requireNonNull(end, "end column cannot be null");
        discrete = List.copyOf(discrete);
        if (start.equals(end)) {
            throw new SchemaException("Start and end columns must differ, both are '" + start + "'");
        }
        if (discrete.contains(start) || discrete.contains(end)) {
            throw new SchemaException("Continuous columns " + List.of(start, end)
                    + " cannot also be discrete columns " + discrete);
        }
    }

    /**
     * Builds a layout from a discrete column list and a continuous column list.
     *
     * @throws SchemaException if the continuous list does not hold exactly two columns
     */
    public static SegmentLayout of(List<String> discrete, List<String> continuous) {
        if (continuous == null || continuous.size() != 2) {
            throw new SchemaException("Exactly two continuous columns are required, got " + continuous);
        }
        return new SegmentLayout(discrete, continuous.get(0), continuous.get(1));
    }

    public List<String> continuous() {
        return List.of(start, end);
    }

    /** Discrete columns followed by start and end. */
    public List<String> indexColumns() {
        List<String> out = new ArrayList<>(discrete);
        out.add(start);
        out.add(end);
        return out;
    }

    /** Discrete columns followed by start. */
    public List<String> trackOrder() {
        List<String> out = new ArrayList<>(discrete);
        out.add(start);
        return out;
    }

    /** Columns of the table that are neither discrete nor continuous, in table order. */
    public List<String> payloadColumns(SegmentTable table) {
        List<String> index = indexColumns();
        List<String> out = new ArrayList<>();
        for (String c : table.columns()) {
            if (!index.contains(c)) {
                out.add(c);
            }
        }
        return out;
    }

    /** Discrete columns that the table actually carries. */
    public List<String> discretePresentIn(SegmentTable table) {
        List<String> out = new ArrayList<>();
        for (String c : discrete) {
            if (table.hasColumn(c)) {
                out.add(c);
            }
        }
        return out;
    }

    /** True when the table lacks at least one of the two continuous columns. */
    public boolean isEventIndexed(SegmentTable table) {
        return !(table.hasColumn(start) && table.hasColumn(end));
    }

    /** Same layout with different discrete columns. */
    public SegmentLayout withDiscrete(List<String> newDiscrete) {
        return new SegmentLayout(newDiscrete, start, end);
    }

    /**
     * Checks that every discrete and continuous column exists in the table.
     *
     * @throws SchemaException naming the missing columns
     */
    public void requireColumns(SegmentTable table, String tableName) {
        List<String> missing = new ArrayList<>();
        for (String c : indexColumns()) {
            if (!table.hasColumn(c)) {
                missing.add(c);
            }
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(String.format(
                    "%s is missing column(s) %s, available: %s", tableName, missing, table.columns()));
        }
    }
}
