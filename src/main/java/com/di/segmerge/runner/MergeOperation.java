package com.di.segmerge.runner;

/** Operation run by {@link MergeJobRunner}. */
public enum MergeOperation {
    MERGE(true),
    OVERLAY_MERGE(true),
    MERGE_EVENT(true),
    AGGREGATE_CONSTANT(false),
    REGULAR_SEGMENTATION(false),
    BUILD_ADMISSIBLE(false),
    CREATE_CONTINUITY(false);

    private final boolean twoTables;

    MergeOperation(boolean twoTables) {
        this.twoTables = twoTables;
    }

    /** True when the operation reads a right-hand table as well. */
    public boolean isTwoTables() {
        return twoTables;
    }
}
