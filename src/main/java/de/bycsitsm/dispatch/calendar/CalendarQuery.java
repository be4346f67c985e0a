package de.bycsitsm.dispatch.calendar;

import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Parameters of one combined-calendar request. Empty id sets mean "no filter".
 *
 * @param organizationId  the organization whose calendar is read
 * @param range           the inclusive day range
 * @param workerIds       local worker ids to restrict to
 * @param teamIds         local team ids whose members to restrict to
 * @param externalAdminIds field-service administrator ids to restrict external tasks to
 * @param externalTeamIds field-service team ids whose members to restrict external tasks to
 * @param sources         the sources to read; empty means all
 */
public record CalendarQuery(
        long organizationId,
        DateRange range,
        Set<Long> workerIds,
        Set<Long> teamIds,
        Set<Long> externalAdminIds,
        Set<Long> externalTeamIds,
        Set<EventType> sources
) {

    public CalendarQuery {
        if (range == null) {
            throw new CalendarQueryException("Start date and end date are required.");
        }
        workerIds = workerIds == null ? Set.of() : Set.copyOf(workerIds);
        teamIds = teamIds == null ? Set.of() : Set.copyOf(teamIds);
        externalAdminIds = externalAdminIds == null ? Set.of() : Set.copyOf(externalAdminIds);
        externalTeamIds = externalTeamIds == null ? Set.of() : Set.copyOf(externalTeamIds);
        sources = sources == null || sources.isEmpty()
                ? Set.copyOf(EnumSet.allOf(EventType.class))
                : Set.copyOf(sources);
    }

    public static CalendarQuery forRange(long organizationId, DateRange range) {
        return new CalendarQuery(organizationId, range, Set.of(), Set.of(), Set.of(), Set.of(), Set.of());
    }

    public CalendarQuery withWorkers(Set<Long> ids) {
        return new CalendarQuery(organizationId, range, ids, teamIds, externalAdminIds, externalTeamIds, sources);
    }

    public CalendarQuery withTeams(Set<Long> ids) {
        return new CalendarQuery(organizationId, range, workerIds, ids, externalAdminIds, externalTeamIds, sources);
    }

    public CalendarQuery withExternalAdmins(Set<Long> ids) {
        return new CalendarQuery(organizationId, range, workerIds, teamIds, ids, externalTeamIds, sources);
    }

    public CalendarQuery withExternalTeams(Set<Long> ids) {
        return new CalendarQuery(organizationId, range, workerIds, teamIds, externalAdminIds, ids, sources);
    }

    public CalendarQuery withSources(Set<EventType> types) {
        return new CalendarQuery(organizationId, range, workerIds, teamIds, externalAdminIds, externalTeamIds, types);
    }

    public boolean includes(EventType type) {
        return sources.contains(type);
    }

    /**
     * Whether a local worker or team filter was supplied.
     */
    public boolean hasWorkerFilter() {
        return !workerIds.isEmpty() || !teamIds.isEmpty();
    }

    public boolean hasExternalFilter() {
        return !externalAdminIds.isEmpty() || !externalTeamIds.isEmpty();
    }

    /**
     * Returns a readable summary of the supplied filters, in a stable order.
     */
    public Set<String> describeFilters() {
        var filters = new LinkedHashSet<String>();
        if (!workerIds.isEmpty()) {
            filters.add("workers=" + sorted(workerIds));
        }
        if (!teamIds.isEmpty()) {
            filters.add("teams=" + sorted(teamIds));
        }
        if (!externalAdminIds.isEmpty()) {
            filters.add("externalAdmins=" + sorted(externalAdminIds));
        }
        if (!externalTeamIds.isEmpty()) {
            filters.add("externalTeams=" + sorted(externalTeamIds));
        }
        if (sources.size() < EventType.values().length) {
            filters.add("sources=" + sources.stream().map(EventType::key).sorted().toList());
        }
        return filters;
    }

    private static Object sorted(Set<Long> ids) {
        return ids.stream().sorted().toList();
    }
}
