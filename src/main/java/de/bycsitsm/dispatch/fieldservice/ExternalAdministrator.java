package de.bycsitsm.dispatch.fieldservice;

import org.jspecify.annotations.Nullable;

/**
 * An administrator account of the field-service platform. Scheduled jobs are
 * assigned to administrators or to teams of administrators.
 *
 * @param id       the administrator id
 * @param login    the login name
 * @param fullName the full name, if known
 * @param email    the email address, if known
 * @param active   whether the account is active
 */
public record ExternalAdministrator(
        long id,
        String login,
        @Nullable String fullName,
        @Nullable String email,
        boolean active
) {

    public String displayName() {
        return fullName != null && !fullName.isBlank() ? fullName : login;
    }
}
