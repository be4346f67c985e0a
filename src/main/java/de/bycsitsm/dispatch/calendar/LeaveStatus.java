package de.bycsitsm.dispatch.calendar;

import java.util.Locale;

/**
 * Approval state of a {@link LeaveRequest}.
 */
public enum LeaveStatus {
    PENDING,
    APPROVED,
    REJECTED;

    public static LeaveStatus parse(String value) {
        return valueOf(value.strip().toUpperCase(Locale.ROOT));
    }
}
