package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A leave (holiday) request of a worker. Only approved requests make the worker busy.
 *
 * @param id        the request id
 * @param workerId  the requesting worker
 * @param startDate the first day of leave
 * @param endDate   the last day of leave (inclusive)
 * @param leaveType the kind of leave (e.g. {@code annual}, {@code sick}), if set
 * @param status    the approval state
 * @param daysCount the number of leave days charged, if recorded
 * @param notes     free-text notes, if any
 */
public record LeaveRequest(
        long id,
        long workerId,
        LocalDate startDate,
        LocalDate endDate,
        @Nullable String leaveType,
        LeaveStatus status,
        @Nullable BigDecimal daysCount,
        @Nullable String notes
) {

    public boolean isApproved() {
        return status == LeaveStatus.APPROVED;
    }
}
