package de.bycsitsm.dispatch.directory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reconciles the local worker directory with the field-service platform's
 * administrator ids for one organization.
 * <p>
 * Instances are immutable snapshots of the directory taken at the start of a
 * request; they are never shared between requests.
 */
public final class IdentityResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    private final Map<Long, Worker> workersById = new LinkedHashMap<>();
    private final Map<Long, Team> teamsById = new LinkedHashMap<>();
    private final Map<Long, Set<Long>> membersByTeam = new HashMap<>();
    private final Map<Long, Long> workerByExternalAdminId = new HashMap<>();
    private final List<TeamMembership> memberships;

    IdentityResolver(List<Worker> workers, List<Team> teams, List<TeamMembership> memberships) {
        this.memberships = List.copyOf(memberships);

        workers.stream()
                .sorted(Comparator.comparingLong(Worker::id))
                .forEach(worker -> {
                    workersById.put(worker.id(), worker);
                    var adminId = worker.externalAdminId();
                    if (adminId == null) {
                        return;
                    }
                    var previous = workerByExternalAdminId.putIfAbsent(adminId, worker.id());
                    if (previous != null) {
                        log.warn("Field-service admin {} is mapped to workers {} and {}; keeping {}",
                                adminId, previous, worker.id(), previous);
                    }
                });

        for (var team : teams) {
            teamsById.put(team.id(), team);
        }
        for (var membership : memberships) {
            membersByTeam.computeIfAbsent(membership.teamId(), id -> new LinkedHashSet<>())
                    .add(membership.workerId());
        }
    }

    /**
     * Takes a snapshot of the organization's directory.
     */
    public static IdentityResolver load(WorkerDirectory directory, long organizationId) {
        return new IdentityResolver(
                directory.listWorkersInOrg(organizationId),
                directory.listTeams(organizationId),
                directory.listTeamMemberships(organizationId));
    }

    /**
     * Returns the union of the explicit worker ids and the members of the given teams.
     * Unknown team ids contribute nothing.
     */
    public Set<Long> resolveEffectiveWorkerIds(Collection<Long> workerIds, Collection<Long> teamIds) {
        var result = new LinkedHashSet<>(workerIds);
        for (var teamId : teamIds) {
            result.addAll(teamMembers(teamId));
        }
        return result;
    }

    /**
     * Returns the union of the given workers' field-service mappings and the explicit
     * administrator ids. Unmapped workers contribute nothing.
     */
    public Set<Long> resolveExternalAdminIds(Collection<Long> workerIds, Collection<Long> explicitExternalIds) {
        var result = new LinkedHashSet<Long>();
        for (var workerId : workerIds) {
            var worker = workersById.get(workerId);
            if (worker != null && worker.externalAdminId() != null) {
                result.add(worker.externalAdminId());
            }
        }
        result.addAll(explicitExternalIds);
        return result;
    }

    public Optional<Long> mapExternalAdminIdToWorker(long externalAdminId) {
        return Optional.ofNullable(workerByExternalAdminId.get(externalAdminId));
    }

    public Optional<Worker> findWorker(long workerId) {
        return Optional.ofNullable(workersById.get(workerId));
    }

    public Optional<Team> findTeam(long teamId) {
        return Optional.ofNullable(teamsById.get(teamId));
    }

    public Set<Long> teamMembers(long teamId) {
        var members = membersByTeam.get(teamId);
        return members != null ? Collections.unmodifiableSet(members) : Set.of();
    }

    public List<Worker> workers() {
        return List.copyOf(workersById.values());
    }

    public List<Team> teams() {
        return List.copyOf(teamsById.values());
    }

    public List<TeamMembership> memberships() {
        return memberships;
    }
}
