package de.bycsitsm.dispatch.directory;

/**
 * A local grouping of workers.
 *
 * @param id   the local team id
 * @param name the team name
 */
public record Team(long id, String name) {
}
