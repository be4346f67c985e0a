package de.bycsitsm.dispatch.directory;

/**
 * Links a worker to a team. A worker may belong to several teams.
 *
 * @param teamId   the local team id
 * @param workerId the local worker id
 * @param role     the role of the worker within the team (e.g. {@code member}, {@code lead})
 */
public record TeamMembership(long teamId, long workerId, String role) {
}
