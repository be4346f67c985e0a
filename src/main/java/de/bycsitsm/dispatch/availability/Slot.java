package de.bycsitsm.dispatch.availability;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A free interval in which the requested work, including travel, fits.
 *
 * @param start       the start of the interval
 * @param end         the end of the interval
 * @param displayTime the start time for display (e.g. {@code 9:30 AM})
 * @param displayDate the day for display (e.g. {@code Mon, Jan 6})
 * @param freeMembers the team members free for the whole interval; empty for individual searches
 */
public record Slot(
        LocalDateTime start,
        LocalDateTime end,
        String displayTime,
        String displayDate,
        List<Long> freeMembers
) {

    public Slot {
        freeMembers = List.copyOf(freeMembers);
    }

    Slot withFreeMembers(List<Long> members) {
        return new Slot(start, end, displayTime, displayDate, members);
    }
}
