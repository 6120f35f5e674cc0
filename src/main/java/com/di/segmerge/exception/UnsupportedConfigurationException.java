package com.di.segmerge.exception;

/**
 * Thrown when a merge is asked to combine inputs whose indexing it cannot handle,
 * e.g. two event-indexed tables.
 */
public class UnsupportedConfigurationException extends RuntimeException {

    public UnsupportedConfigurationException(String message) {
        super(message);
    }
}
