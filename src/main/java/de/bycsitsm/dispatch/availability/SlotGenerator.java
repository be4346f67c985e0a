package de.bycsitsm.dispatch.availability;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Finds the free slots of one worker.
 * <p>
 * Candidate starts lie on a 30-minute grid within the working hours of each
 * weekday in the range. A candidate is kept if the work including travel ends
 * within the working hours, overlaps no busy interval and starts in the future.
 */
@Component
public class SlotGenerator {

    static final int SLOT_STEP_MINUTES = 30;

    private static final DateTimeFormatter TIME_FORMATTER = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("EEE, MMM d", Locale.US);

    private final Clock clock;

    public SlotGenerator(Clock clock) {
        this.clock = clock;
    }

    /**
     * Returns the free slots, ordered by start.
     *
     * @param request       the range, durations and working hours
     * @param busyIntervals the times the worker is already committed
     */
    public List<Slot> generate(SlotRequest request, Collection<BusyInterval> busyIntervals) {
        var now = LocalDateTime.now(clock);
        var hours = request.workingHours();
        var total = request.totalMinutes();
        var slots = new ArrayList<Slot>();

        request.range().days()
                .filter(day -> day.getDayOfWeek() != DayOfWeek.SATURDAY && day.getDayOfWeek() != DayOfWeek.SUNDAY)
                .forEach(day -> {
                    var dayEnd = day.atTime(hours.end());
                    for (var start = day.atTime(hours.start()); start.isBefore(dayEnd);
                         start = start.plusMinutes(SLOT_STEP_MINUTES)) {
                        var end = start.plusMinutes(total);
                        if (end.isAfter(dayEnd)) {
                            break;
                        }
                        if (!start.isAfter(now) || isBusy(busyIntervals, start, end)) {
                            continue;
                        }
                        slots.add(new Slot(start, end, start.format(TIME_FORMATTER), start.format(DATE_FORMATTER),
                                List.of()));
                    }
                });
        return slots;
    }

    private static boolean isBusy(Collection<BusyInterval> busyIntervals, LocalDateTime start, LocalDateTime end) {
        for (var busy : busyIntervals) {
            if (busy.overlaps(start, end)) {
                return true;
            }
        }
        return false;
    }
}
