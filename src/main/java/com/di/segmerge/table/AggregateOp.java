package com.di.segmerge.table;

/** Aggregations supported by {@link TabularStore#groupAggregate}. */
public enum AggregateOp {
    MIN,
    MAX,
    COUNT,
    SUM
}
