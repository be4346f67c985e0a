package de.bycsitsm.dispatch.calendar;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link CalendarRepository} over in-memory lists, with the same range and id
 * filtering as the database adapter. Sources can be made to fail.
 */
public class InMemoryCalendarRepository implements CalendarRepository {

    private final List<CalendarBlock> blocks = new ArrayList<>();
    private final List<LeaveRequest> leave = new ArrayList<>();
    private final List<PublicHoliday> holidays = new ArrayList<>();
    private final List<WorkItem> workItems = new ArrayList<>();
    private final Map<EventType, RuntimeException> failures = new EnumMap<>(EventType.class);

    public InMemoryCalendarRepository block(long id, long workerId, LocalDateTime start, LocalDateTime end) {
        blocks.add(new CalendarBlock(id, workerId, "Block " + id, "meeting", null, start, end, false, null,
                false, true, null));
        return this;
    }

    public InMemoryCalendarRepository block(CalendarBlock block) {
        blocks.add(block);
        return this;
    }

    public InMemoryCalendarRepository leave(long id, long workerId, LocalDate start, LocalDate end,
                                            LeaveStatus status) {
        leave.add(new LeaveRequest(id, workerId, start, end, "annual", status, null, null));
        return this;
    }

    public InMemoryCalendarRepository holiday(long id, String name, LocalDate date) {
        holidays.add(new PublicHoliday(id, name, date, null, null));
        return this;
    }

    public InMemoryCalendarRepository workItem(long id, LocalDate dueDate, Long assigneeId, Long teamId) {
        workItems.add(new WorkItem(id, "Work item " + id, dueDate, assigneeId, teamId, "open", "task"));
        return this;
    }

    public InMemoryCalendarRepository fail(EventType source, RuntimeException e) {
        failures.put(source, e);
        return this;
    }

    @Override
    public List<CalendarBlock> findBlocks(long organizationId, DateRange range, Set<Long> workerIds) {
        failIfRequested(EventType.BLOCK);
        return blocks.stream()
                .filter(block -> workerIds == null || workerIds.contains(block.workerId()))
                .filter(block -> block.start().isBefore(range.end().plusDays(1).atStartOfDay())
                        && !block.end().isBefore(range.firstMoment()))
                .toList();
    }

    /**
     * Returns every request of the range, approved or not, so callers have to check the status.
     */
    @Override
    public List<LeaveRequest> findApprovedLeave(long organizationId, DateRange range, Set<Long> workerIds) {
        failIfRequested(EventType.LEAVE);
        return leave.stream()
                .filter(request -> workerIds == null || workerIds.contains(request.workerId()))
                .filter(request -> !request.startDate().isAfter(range.end())
                        && !request.endDate().isBefore(range.start()))
                .toList();
    }

    @Override
    public List<PublicHoliday> findPublicHolidays(long organizationId, DateRange range) {
        failIfRequested(EventType.PUBLIC_HOLIDAY);
        return holidays.stream().filter(holiday -> range.contains(holiday.date())).toList();
    }

    @Override
    public List<WorkItem> findWorkItems(long organizationId, DateRange range, Set<Long> workerIds,
                                        Set<Long> teamIds) {
        failIfRequested(EventType.WORK_ITEM);
        return workItems.stream()
                .filter(item -> item.dueDate() == null || range.contains(item.dueDate()))
                .filter(item -> workerIds == null && teamIds == null
                        || workerIds != null && item.assigneeId() != null && workerIds.contains(item.assigneeId())
                        || teamIds != null && item.teamId() != null && teamIds.contains(item.teamId()))
                .toList();
    }

    private void failIfRequested(EventType source) {
        var failure = failures.get(source);
        if (failure != null) {
            throw failure;
        }
    }
}
