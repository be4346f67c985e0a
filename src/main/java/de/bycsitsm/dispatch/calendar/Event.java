package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * One entry of the combined calendar, normalized from any source.
 * <p>
 * All-day events start and end at the start of their first and last day;
 * {@code end} is then inclusive at day granularity. Timed events cover
 * {@code [start, end)}.
 *
 * @param id                 the source-prefixed id, unique within one aggregation result
 * @param title              the display title
 * @param start              the start
 * @param end                the end
 * @param allDay             whether the event covers whole days
 * @param type               the source of the event
 * @param color              the display color
 * @param ownerWorkerId      the local worker the event belongs to, if known
 * @param ownerName          the display name of the owner, if any
 * @param status             the source record's status, if any
 * @param origin             whether the record is local or from the field-service platform
 * @param blocksAvailability whether the event makes its owner unavailable for bookings
 * @param metadata           additional source-specific values
 */
public record Event(
        String id,
        String title,
        LocalDateTime start,
        LocalDateTime end,
        boolean allDay,
        EventType type,
        String color,
        @Nullable Long ownerWorkerId,
        @Nullable String ownerName,
        @Nullable String status,
        EventOrigin origin,
        boolean blocksAvailability,
        Map<String, Object> metadata
) {

    public Event {
        metadata = Map.copyOf(metadata);
    }

    /**
     * Returns a copy restricted to the given range. All-day events are clipped at
     * day granularity, timed events to the last moment of the range's final day.
     */
    public Event clippedTo(DateRange range) {
        var first = range.firstMoment();
        var last = allDay ? range.end().atStartOfDay() : range.lastMoment();
        var clippedStart = start.isBefore(first) ? first : start;
        var clippedEnd = end.isAfter(last) ? last : end;
        if (clippedStart.equals(start) && clippedEnd.equals(end)) {
            return this;
        }
        return new Event(id, title, clippedStart, clippedEnd, allDay, type, color, ownerWorkerId, ownerName,
                status, origin, blocksAvailability, metadata);
    }

    public boolean overlaps(DateRange range) {
        return !start.toLocalDate().isAfter(range.end()) && !end.toLocalDate().isBefore(range.start());
    }
}
