package de.bycsitsm.dispatch.directory;

import org.jspecify.annotations.Nullable;

/**
 * A local worker who can be assigned work and owns a calendar.
 *
 * @param id              the local worker id
 * @param name            the display name
 * @param email           the email address
 * @param externalAdminId the worker's administrator id in the field-service platform, or {@code null} if unmapped
 */
public record Worker(
        long id,
        String name,
        @Nullable String email,
        @Nullable Long externalAdminId
) {

    /**
     * Returns the name, falling back to the email address when the name is blank.
     */
    public String displayName() {
        if (!name.isBlank() || email == null) {
            return name;
        }
        return email;
    }
}
