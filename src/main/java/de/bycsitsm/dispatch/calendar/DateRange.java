package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.stream.Stream;

/**
 * An inclusive range of calendar days in the organization's local time.
 *
 * @param start the first day
 * @param end   the last day (inclusive)
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null || end == null) {
            throw new CalendarQueryException("Start date and end date are required.");
        }
        if (end.isBefore(start)) {
            throw new CalendarQueryException("End date " + end + " is before start date " + start + ".");
        }
    }

    /**
     * Creates a range from possibly missing request parameters.
     *
     * @throws CalendarQueryException if either date is missing or the end precedes the start
     */
    public static DateRange of(@Nullable LocalDate start, @Nullable LocalDate end) {
        return new DateRange(start, end);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public long lengthInDays() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    public LocalDateTime firstMoment() {
        return start.atStartOfDay();
    }

    public LocalDateTime lastMoment() {
        return end.atTime(LocalTime.MAX);
    }

    public Stream<LocalDate> days() {
        return start.datesUntil(end.plusDays(1));
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
