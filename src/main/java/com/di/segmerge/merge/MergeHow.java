package com.di.segmerge.merge;

import com.di.segmerge.table.JoinType;

/**
 * Which pieces of the breakpoint partition an interval merge keeps.
 */
public enum MergeHow {

    /** Pieces covered by the left table. */
    LEFT,
    /** Pieces covered by the right table. */
    RIGHT,
    /** Pieces covered by both tables. */
    INNER,
    /** Pieces covered by at least one table. */
    OUTER;

    /**
     * Parses {@code "left"}, {@code "right"}, {@code "inner"} or {@code "outer"}.
     *
     * @throws com.di.segmerge.exception.SchemaException for any other value
     */
    public static MergeHow fromName(String name) {
        return of(JoinType.fromName(name));
    }

    public static MergeHow of(JoinType joinType) {
        return MergeHow.valueOf(joinType.name());
    }
}
