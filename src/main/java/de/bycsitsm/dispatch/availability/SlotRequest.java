package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import de.bycsitsm.dispatch.calendar.DateRange;

/**
 * What to search free slots for.
 *
 * @param range           the days to search
 * @param durationMinutes the length of the work itself
 * @param travelMinutes   travel time needed before and after the work
 * @param workingHours    the bookable daily window
 */
public record SlotRequest(
        DateRange range,
        int durationMinutes,
        int travelMinutes,
        WorkingHours workingHours
) {

    public SlotRequest {
        if (durationMinutes <= 0) {
            throw new CalendarQueryException("Duration must be positive, was " + durationMinutes + " minutes.");
        }
        if (travelMinutes < 0) {
            throw new CalendarQueryException("Travel time must not be negative, was " + travelMinutes + " minutes.");
        }
        if (workingHours == null) {
            throw new CalendarQueryException("Working hours are required.");
        }
        var total = durationMinutes + 2L * travelMinutes;
        var window = workingHours.lengthInMinutes();
        if (total > window) {
            throw new CalendarQueryException("Duration plus travel is " + total + " minutes; at most " + window
                    + " fit into working hours " + workingHours.start() + "-" + workingHours.end() + ".");
        }
    }

    /**
     * The time a slot has to cover: travel there, the work, travel back.
     */
    public long totalMinutes() {
        return durationMinutes + 2L * travelMinutes;
    }
}
