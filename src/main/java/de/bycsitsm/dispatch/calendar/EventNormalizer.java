package de.bycsitsm.dispatch.calendar;

import de.bycsitsm.dispatch.directory.IdentityResolver;
import de.bycsitsm.dispatch.directory.Worker;
import de.bycsitsm.dispatch.fieldservice.ExternalAdministrator;
import de.bycsitsm.dispatch.fieldservice.ExternalTask;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.Map;

/**
 * Turns the native records of each calendar source into {@link Event}s.
 * <p>
 * Every method maps exactly one record and either returns its event or throws
 * {@link MalformedRecordException}. Lookups only read the snapshots passed in
 * at construction; nothing is fetched.
 */
public class EventNormalizer {

    static final LocalTime DEFAULT_TASK_TIME = LocalTime.of(9, 0);

    private final IdentityResolver identities;
    private final Map<Long, ExternalAdministrator> administrators;
    private final Map<Long, ExternalTeam> externalTeams;

    public EventNormalizer(IdentityResolver identities) {
        this(identities, Map.of(), Map.of());
    }

    public EventNormalizer(IdentityResolver identities,
                           Map<Long, ExternalAdministrator> administrators,
                           Map<Long, ExternalTeam> externalTeams) {
        this.identities = identities;
        this.administrators = administrators;
        this.externalTeams = externalTeams;
    }

    public Event normalizeExternalTask(ExternalTask task) {
        if (task.id() == null) {
            throw new MalformedRecordException("Task without id: " + task.title());
        }
        var start = scheduledStart(task);
        if (task.durationMinutes() < 0) {
            throw new MalformedRecordException("Task " + task.id() + " has negative duration " + task.durationMinutes());
        }

        @Nullable Long ownerWorkerId = null;
        String ownerName;
        var assigneeId = task.assigneeId();
        switch (task.assigneeKind()) {
            case ADMINISTRATOR -> {
                ownerWorkerId = assigneeId != null
                        ? identities.mapExternalAdminIdToWorker(assigneeId).orElse(null)
                        : null;
                ownerName = administratorName(assigneeId, ownerWorkerId);
            }
            case TEAM -> {
                var team = assigneeId != null ? externalTeams.get(assigneeId) : null;
                ownerName = team != null ? team.title() : "Team " + assigneeId;
            }
            default -> ownerName = "Unassigned";
        }

        var title = task.title() != null ? task.title()
                : task.description() != null ? task.description()
                : "Field-service task";

        return new Event(
                EventType.EXTERNAL_TASK.eventId(task.id()),
                title,
                start,
                start.plusMinutes(task.durationMinutes()),
                false,
                EventType.EXTERNAL_TASK,
                EventType.EXTERNAL_TASK.defaultColor(),
                ownerWorkerId,
                ownerName,
                task.status(),
                EventOrigin.EXTERNAL,
                true,
                metadata(
                        "assigneeKind", task.assigneeKind().name(),
                        "assigneeId", assigneeId,
                        "projectId", task.projectId(),
                        "customerId", task.customerId(),
                        "location", task.location()));
    }

    public Event normalizeWorkItem(WorkItem item) {
        var dueDate = item.dueDate();
        if (dueDate == null) {
            throw new MalformedRecordException("Work item " + item.id() + " has no due date");
        }

        var owner = item.assigneeId() != null ? identities.findWorker(item.assigneeId()).orElse(null) : null;
        return new Event(
                EventType.WORK_ITEM.eventId(item.id()),
                item.title(),
                dueDate.atStartOfDay(),
                dueDate.atStartOfDay(),
                true,
                EventType.WORK_ITEM,
                EventType.WORK_ITEM.defaultColor(),
                item.assigneeId(),
                owner != null ? owner.displayName() : null,
                item.status(),
                EventOrigin.LOCAL,
                false,
                metadata(
                        "workItemId", item.id(),
                        "teamId", item.teamId(),
                        "workItemType", item.workItemType()));
    }

    /**
     * @throws MalformedRecordException if the request is not approved or ends before it starts
     */
    public Event normalizeLeave(LeaveRequest request) {
        if (!request.isApproved()) {
            throw new MalformedRecordException("Leave request " + request.id() + " is " + request.status());
        }
        if (request.endDate().isBefore(request.startDate())) {
            throw new MalformedRecordException("Leave request " + request.id() + " ends before it starts");
        }

        var ownerName = identities.findWorker(request.workerId()).map(Worker::displayName).orElse(null);
        var leaveType = request.leaveType() != null ? request.leaveType() : "Leave";
        return new Event(
                EventType.LEAVE.eventId(request.id()),
                (ownerName != null ? ownerName : "Worker") + " - " + leaveType,
                request.startDate().atStartOfDay(),
                request.endDate().atStartOfDay(),
                true,
                EventType.LEAVE,
                EventType.LEAVE.defaultColor(),
                request.workerId(),
                ownerName,
                request.status().name().toLowerCase(),
                EventOrigin.LOCAL,
                true,
                metadata(
                        "leaveType", request.leaveType(),
                        "daysCount", request.daysCount(),
                        "notes", request.notes()));
    }

    public Event normalizePublicHoliday(PublicHoliday holiday) {
        return new Event(
                EventType.PUBLIC_HOLIDAY.eventId(holiday.id()),
                holiday.name(),
                holiday.date().atStartOfDay(),
                holiday.date().atStartOfDay(),
                true,
                EventType.PUBLIC_HOLIDAY,
                EventType.PUBLIC_HOLIDAY.defaultColor(),
                null,
                null,
                null,
                EventOrigin.LOCAL,
                true,
                metadata(
                        "country", holiday.country(),
                        "region", holiday.region()));
    }

    public Event normalizeBlock(CalendarBlock block) {
        if (block.end().isBefore(block.start())) {
            throw new MalformedRecordException("Block " + block.id() + " ends before it starts");
        }

        String title;
        if (block.privateBlock()) {
            title = "Private";
        } else {
            title = block.title() != null && !block.title().isBlank() ? block.title() : block.blockType();
        }
        var start = block.allDay() ? block.start().toLocalDate().atStartOfDay() : block.start();
        var end = block.allDay() ? block.end().toLocalDate().atStartOfDay() : block.end();

        return new Event(
                EventType.BLOCK.eventId(block.id()),
                title,
                start,
                end,
                block.allDay(),
                EventType.BLOCK,
                block.color() != null ? block.color() : EventType.BLOCK.defaultColor(),
                block.workerId(),
                identities.findWorker(block.workerId()).map(Worker::displayName).orElse(null),
                null,
                EventOrigin.LOCAL,
                block.blocksAvailability(),
                metadata(
                        "blockType", block.blockType(),
                        "recurring", block.recurrenceRule() != null,
                        "recurrenceRule", block.recurrenceRule(),
                        "description", block.privateBlock() ? null : block.description()));
    }

    /**
     * Determines when a field-service task starts: the combined
     * {@code scheduled_from} value if it carries a time, otherwise the scheduled
     * date at the scheduled time (09:00 if no time is given).
     *
     * @throws MalformedRecordException if the task has no usable schedule
     */
    public static LocalDateTime scheduledStart(ExternalTask task) {
        try {
            var scheduledFrom = task.scheduledFrom();
            if (scheduledFrom != null && scheduledFrom.length() > 10) {
                return LocalDateTime.parse(scheduledFrom.strip().replace(' ', 'T'));
            }

            var date = task.scheduledDate() != null ? task.scheduledDate() : scheduledFrom;
            if (date == null) {
                throw new MalformedRecordException("Task " + task.id() + " is not scheduled");
            }
            var time = task.scheduledTime() != null ? LocalTime.parse(task.scheduledTime()) : DEFAULT_TASK_TIME;
            return LocalDate.parse(date.strip()).atTime(time);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("Task " + task.id() + " has an unreadable schedule: " + e.getMessage(), e);
        }
    }

    private String administratorName(@Nullable Long administratorId, @Nullable Long workerId) {
        if (workerId != null) {
            var worker = identities.findWorker(workerId);
            if (worker.isPresent()) {
                return worker.get().displayName();
            }
        }
        var administrator = administratorId != null ? administrators.get(administratorId) : null;
        if (administrator != null) {
            return administrator.displayName();
        }
        return "Admin " + administratorId;
    }

    /**
     * Builds a metadata map from alternating keys and values, leaving out {@code null} values.
     */
    private static Map<String, Object> metadata(Object... keysAndValues) {
        var result = new HashMap<String, Object>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            var value = keysAndValues[i + 1];
            if (value != null) {
                result.put((String) keysAndValues[i], value);
            }
        }
        return result;
    }
}
