package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.Event;

import java.time.LocalDateTime;

/**
 * A half-open interval {@code [start, end)} in which a worker cannot take new work.
 */
public record BusyInterval(LocalDateTime start, LocalDateTime end) {

    /**
     * Converts an event into the time it occupies. All-day events occupy their
     * days completely, from midnight of the first day to midnight after the last.
     */
    public static BusyInterval of(Event event) {
        if (event.allDay()) {
            return new BusyInterval(
                    event.start().toLocalDate().atStartOfDay(),
                    event.end().toLocalDate().plusDays(1).atStartOfDay());
        }
        return new BusyInterval(event.start(), event.end());
    }

    public boolean overlaps(LocalDateTime otherStart, LocalDateTime otherEnd) {
        return otherStart.isBefore(end) && otherEnd.isAfter(start);
    }
}
