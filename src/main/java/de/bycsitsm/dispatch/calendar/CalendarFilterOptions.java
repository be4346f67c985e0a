package de.bycsitsm.dispatch.calendar;

import de.bycsitsm.dispatch.directory.Team;
import de.bycsitsm.dispatch.directory.TeamMembership;
import de.bycsitsm.dispatch.directory.Worker;
import de.bycsitsm.dispatch.fieldservice.ExternalAdministrator;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Everything a planner can filter the combined calendar by.
 *
 * @param workers                local workers, with their field-service mapping
 * @param teams                  local teams
 * @param memberships            local team memberships
 * @param externalTeams          field-service teams; empty if the platform could not be reached
 * @param externalAdministrators field-service administrators; empty if the platform could not be reached
 * @param sources                the selectable sources
 * @param externalError          why the field-service lists are missing, or {@code null}
 */
public record CalendarFilterOptions(
        List<Worker> workers,
        List<Team> teams,
        List<TeamMembership> memberships,
        List<ExternalTeam> externalTeams,
        List<ExternalAdministrator> externalAdministrators,
        List<EventType> sources,
        @Nullable String externalError
) {

    public CalendarFilterOptions {
        workers = List.copyOf(workers);
        teams = List.copyOf(teams);
        memberships = List.copyOf(memberships);
        externalTeams = List.copyOf(externalTeams);
        externalAdministrators = List.copyOf(externalAdministrators);
        sources = List.copyOf(sources);
    }
}
