package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Range-scoped reads of the locally persisted calendar sources.
 * <p>
 * Id sets restrict the result; {@code null} means unrestricted. An empty set
 * matches nothing.
 */
public interface CalendarRepository {

    /**
     * Returns blocks overlapping the range.
     */
    List<CalendarBlock> findBlocks(long organizationId, DateRange range, @Nullable Set<Long> workerIds);

    /**
     * Returns approved leave requests overlapping the range.
     */
    List<LeaveRequest> findApprovedLeave(long organizationId, DateRange range, @Nullable Set<Long> workerIds);

    List<PublicHoliday> findPublicHolidays(long organizationId, DateRange range);

    /**
     * Returns work items due within the range that are assigned to one of the
     * workers or belong to one of the teams.
     */
    List<WorkItem> findWorkItems(long organizationId, DateRange range,
                                 @Nullable Set<Long> workerIds, @Nullable Set<Long> teamIds);
}
