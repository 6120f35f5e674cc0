package com.di.segmerge.table;

import com.di.segmerge.exception.SchemaException;

import java.util.Locale;

/**
 * Which rows survive a join. Used both by relational equi-joins and by interval merges.
 */
public enum JoinType {

    INNER,
    LEFT,
    RIGHT,
    OUTER;

    /**
     * Parses {@code "left"}, {@code "right"}, {@code "inner"} or {@code "outer"}, case-insensitively.
     *
     * @throws SchemaException for any other value
     */
    public static JoinType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new SchemaException("How must be in \"left\", \"right\", \"inner\", \"outer\", got: " + name);
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "left":
                return LEFT;
            case "right":
                return RIGHT;
            case "inner":
                return INNER;
            case "outer":
                return OUTER;
            default:
                throw new SchemaException("How must be in \"left\", \"right\", \"inner\", \"outer\", got: " + name);
        }
    }

    /** True when unmatched left rows are kept. */
    public boolean keepsLeft() {
        return this == LEFT || this == OUTER;
    }

    /** True when unmatched right rows are kept. */
    public boolean keepsRight() {
        return this == RIGHT || this == OUTER;
    }
}
