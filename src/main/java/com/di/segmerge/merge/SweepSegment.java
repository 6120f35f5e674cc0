package com.di.segmerge.merge;

import java.util.List;
import java.util.OptionalInt;

/**
 * One piece of the shared breakpoint partition of a track, with the source row that covers
 * it on each side. An empty source means the piece falls in a gap of that side.
 *
 * @param key   discrete key values, in layout order
 * @param start piece start, inclusive
 * @param end   piece end, exclusive
 * @param left  covering row of the left table
 * @param right covering row of the right table
 */
public record SweepSegment(List<Object> key, Object start, Object end, OptionalInt left, OptionalInt right) {

    public boolean bothAbsent() {
        return left.isEmpty() && right.isEmpty();
    }

    /** True when the piece satisfies the coverage required by the join kind. */
    public boolean keptBy(MergeHow how) {
        switch (how) {
            case LEFT:
                return left.isPresent();
            case RIGHT:
                return right.isPresent();
            case INNER:
                return left.isPresent() && right.isPresent();
            case OUTER:
                return !bothAbsent();
            default:
                throw new IllegalStateException("Unhandled join kind " + how);
        }
    }
}
