package de.bycsitsm.dispatch.calendar;

/**
 * Exception thrown when a calendar or availability request is invalid
 * (missing or oversized date range, non-positive duration, unknown worker).
 */
public class CalendarQueryException extends RuntimeException {

    public CalendarQueryException(String message) {
        super(message);
    }
}
