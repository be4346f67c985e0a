package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A manually entered block in a worker's calendar (meeting, training, travel...).
 * <p>
 * The recurrence rule is stored verbatim and not expanded; a recurring block
 * appears once, at its stored start.
 *
 * @param id                 the block id
 * @param workerId           the owning worker
 * @param title              the title, if set
 * @param blockType          the type tag (e.g. {@code meeting}, {@code training}, {@code other})
 * @param description        a description, if set
 * @param start              the start
 * @param end                the end
 * @param allDay             whether the block covers whole days
 * @param recurrenceRule     an RRULE string, if the block repeats
 * @param privateBlock       whether the title and description are hidden from others
 * @param blocksAvailability whether the block makes the worker unavailable for bookings
 * @param color              a display color, if set
 */
public record CalendarBlock(
        long id,
        long workerId,
        @Nullable String title,
        String blockType,
        @Nullable String description,
        LocalDateTime start,
        LocalDateTime end,
        boolean allDay,
        @Nullable String recurrenceRule,
        boolean privateBlock,
        boolean blocksAvailability,
        @Nullable String color
) {
}
