package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarQueryException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Parses booking durations as typed by planners: {@code 2h 30m}, {@code 1h},
 * {@code 90m} or a plain number of minutes. Each number has at most five digits.
 */
public final class BookingDuration {

    private static final Pattern PLAIN_MINUTES = Pattern.compile("\\d{1,5}");
    private static final Pattern HOURS_AND_MINUTES = Pattern.compile("(?:(\\d{1,5})\\s*h)?\\s*(?:(\\d{1,5})\\s*m)?");

    private BookingDuration() {
    }

    /**
     * @throws CalendarQueryException if the text is not a duration or amounts to zero minutes
     */
    public static int parseMinutes(String text) {
        if (text == null || text.isBlank()) {
            throw new CalendarQueryException("Duration must not be empty.");
        }
        var normalized = text.strip().toLowerCase(Locale.ROOT);

        int minutes;
        if (PLAIN_MINUTES.matcher(normalized).matches()) {
            minutes = Integer.parseInt(normalized);
        } else {
            var matcher = HOURS_AND_MINUTES.matcher(normalized);
            if (!matcher.matches()) {
                throw new CalendarQueryException("Invalid duration '" + text + "'. Use e.g. 1h 30m or 90m.");
            }
            var hours = matcher.group(1) != null ? Integer.parseInt(matcher.group(1)) : 0;
            minutes = hours * 60 + (matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : 0);
        }

        if (minutes <= 0) {
            throw new CalendarQueryException("Duration must be positive, was '" + text + "'.");
        }
        return minutes;
    }
}
