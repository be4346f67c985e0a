package de.bycsitsm.dispatch.fieldservice;

import org.jspecify.annotations.Nullable;

/**
 * A scheduled job as delivered by the field-service platform.
 * <p>
 * Scheduling fields are kept in their raw textual form; the platform fills
 * either {@code scheduledFrom} ({@code yyyy-MM-dd HH:mm:ss}) or the separate
 * date and time fields, depending on its version.
 *
 * @param id              the task id, or {@code null} if the platform sent none
 * @param title           the task title, if set
 * @param description     the task description, if set
 * @param scheduledFrom   the combined scheduled start, if set
 * @param scheduledDate   the scheduled date ({@code yyyy-MM-dd}), if set
 * @param scheduledTime   the scheduled time ({@code HH:mm}), if set
 * @param durationMinutes the planned duration in minutes
 * @param assigneeKind    whether the task is assigned to an administrator or a team
 * @param assigneeId      the administrator or team id, or {@code null} if unassigned
 * @param status          the workflow status, if set
 * @param projectId       the project the task belongs to, if any
 * @param customerId      the related customer, if any
 * @param location        the job location, if set
 */
public record ExternalTask(
        @Nullable String id,
        @Nullable String title,
        @Nullable String description,
        @Nullable String scheduledFrom,
        @Nullable String scheduledDate,
        @Nullable String scheduledTime,
        int durationMinutes,
        AssigneeKind assigneeKind,
        @Nullable Long assigneeId,
        @Nullable String status,
        @Nullable Long projectId,
        @Nullable Long customerId,
        @Nullable String location
) {
}
