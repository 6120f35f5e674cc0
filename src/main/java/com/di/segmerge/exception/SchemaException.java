package com.di.segmerge.exception;

/**
 * Thrown when the columns requested for an operation do not fit the tables passed to it:
 * a discrete or continuous column missing from the inputs, a continuous index that is not
 * exactly two columns wide, or an unknown join kind.
 *
 * <p>Always raised before any computation starts.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }
}
