package de.bycsitsm.dispatch.fieldservice;

import org.jspecify.annotations.Nullable;

/**
 * Server-side filter hints for {@link FieldServiceClient#listTasks(TaskQuery)}.
 * The platform offers no reliable date filtering, so there is no date
 * criterion here; callers filter the returned tasks by scheduled date.
 *
 * @param administratorId restrict to tasks assigned to this administrator
 * @param teamId          restrict to tasks assigned to this team
 */
public record TaskQuery(
        @Nullable Long administratorId,
        @Nullable Long teamId
) {

    public static TaskQuery all() {
        return new TaskQuery(null, null);
    }

    public static TaskQuery forAdministrator(long administratorId) {
        return new TaskQuery(administratorId, null);
    }

    public static TaskQuery forTeam(long teamId) {
        return new TaskQuery(null, teamId);
    }
}
