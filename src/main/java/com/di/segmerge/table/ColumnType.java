package com.di.segmerge.table;

/** Target types for {@link TabularStore#castColumnType}. */
public enum ColumnType {
    /** 64-bit integer; decimals are truncated toward zero. */
    LONG,
    DOUBLE,
    STRING
}
