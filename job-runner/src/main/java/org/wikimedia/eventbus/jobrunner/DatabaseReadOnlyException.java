package org.wikimedia.eventbus.jobrunner;

/**
 * Thrown by jobs trying to write while the database is read-only.
 */
public class DatabaseReadOnlyException extends RuntimeException {
    public DatabaseReadOnlyException(String message) {
        super(message);
    }
}
