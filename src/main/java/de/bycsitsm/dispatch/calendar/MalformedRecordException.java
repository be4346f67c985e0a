package de.bycsitsm.dispatch.calendar;

/**
 * Exception thrown when a single source record cannot be turned into an {@link Event}.
 * The record is skipped and counted; the remaining records are still processed.
 */
public class MalformedRecordException extends RuntimeException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
