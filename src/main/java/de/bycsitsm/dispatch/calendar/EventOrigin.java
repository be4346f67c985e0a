package de.bycsitsm.dispatch.calendar;

/**
 * Which system owns the record behind an {@link Event}.
 */
public enum EventOrigin {
    LOCAL,
    EXTERNAL
}
