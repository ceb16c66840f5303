package org.wikimedia.eventbus.common.model;

/**
 * Thrown when revision data is hidden from the current audience.
 */
public class SuppressedDataException extends Exception {
    public SuppressedDataException(String message) {
        super(message);
    }
}
