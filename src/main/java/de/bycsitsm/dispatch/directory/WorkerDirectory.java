package de.bycsitsm.dispatch.directory;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the local workforce directory of an organization.
 */
public interface WorkerDirectory {

    List<Worker> listWorkersInOrg(long organizationId);

    List<Team> listTeams(long organizationId);

    List<TeamMembership> listTeamMemberships(long organizationId);

    /**
     * Returns the field-service administrator id mapped to the given worker, if any.
     */
    Optional<Long> getWorkerExternalMapping(long workerId);
}
