package de.bycsitsm.dispatch.fieldservice;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A scheduling team as maintained in the field-service platform.
 *
 * @param id        the team id in the field-service platform
 * @param title     the team title
 * @param partnerId the partner (reseller) the team belongs to, if any
 * @param memberIds the administrator ids of the team members
 * @param color     the team color (hex string like {@code #3B82F6}), if set
 */
public record ExternalTeam(
        long id,
        String title,
        @Nullable Long partnerId,
        List<Long> memberIds,
        @Nullable String color
) {

    public ExternalTeam {
        memberIds = List.copyOf(memberIds);
    }
}
