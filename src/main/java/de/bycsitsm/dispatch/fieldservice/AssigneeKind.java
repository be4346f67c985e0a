package de.bycsitsm.dispatch.fieldservice;

/**
 * What a scheduled job is assigned to.
 */
public enum AssigneeKind {
    ADMINISTRATOR,
    TEAM,
    NONE
}
