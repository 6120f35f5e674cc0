package com.di.segmerge.merge;

/**
 * What an overlay merge does with one segment of the base table.
 */
public enum BaseSegmentFate {

    /** Fully covered by override segments; only override rows are emitted over it. */
    ENCOMPASSED,

    /** Partly covered; split at override boundaries, the uncovered pieces keep the base payload. */
    TO_RESOLVE,

    /** Not touched by any override segment; emitted unchanged. */
    OUT
}
