package de.bycsitsm.dispatch.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;

/**
 * An organization-wide public holiday, optionally scoped to a country or region.
 */
public record PublicHoliday(
        long id,
        String name,
        LocalDate date,
        @Nullable String country,
        @Nullable String region
) {
}
