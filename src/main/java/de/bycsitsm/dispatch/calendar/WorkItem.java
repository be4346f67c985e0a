package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * An internally tracked deliverable. It has a due date, not a duration.
 *
 * @param id           the work item id
 * @param title        the title
 * @param dueDate      the due date, or {@code null} if none was set
 * @param assigneeId   the assigned worker, if any
 * @param teamId       the owning team, if any
 * @param status       the workflow status, if set
 * @param workItemType the type of work item, if set
 */
public record WorkItem(
        long id,
        String title,
        @Nullable LocalDate dueDate,
        @Nullable Long assigneeId,
        @Nullable Long teamId,
        @Nullable String status,
        @Nullable String workItemType
) {
}
