package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarQueryException;

import java.time.Duration;
import java.time.LocalTime;

/**
 * The daily window in which work can be booked.
 *
 * @param start the first possible start time
 * @param end   the time by which booked work must be finished
 */
public record WorkingHours(LocalTime start, LocalTime end) {

    public static final WorkingHours DEFAULT = new WorkingHours(LocalTime.of(9, 0), LocalTime.of(17, 0));

    public WorkingHours {
        if (start == null || end == null) {
            throw new CalendarQueryException("Working hours need a start and an end.");
        }
        if (!end.isAfter(start)) {
            throw new CalendarQueryException("Working hours end " + end + " is not after start " + start + ".");
        }
    }

    public long lengthInMinutes() {
        return Duration.between(start, end).toMinutes();
    }
}
