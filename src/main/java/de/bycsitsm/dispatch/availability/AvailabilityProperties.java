package de.bycsitsm.dispatch.availability;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalTime;

/**
 * Configuration properties for slot search.
 *
 * @param workingHoursStart start of the bookable day ({@code HH:mm}), defaults to {@code 09:00}
 * @param workingHoursEnd   end of the bookable day ({@code HH:mm}), defaults to {@code 17:00}
 */
@ConfigurationProperties(prefix = "dispatch.availability")
public record AvailabilityProperties(
        String workingHoursStart,
        String workingHoursEnd
) {

    public AvailabilityProperties {
        if (workingHoursStart == null || workingHoursStart.isBlank()) {
            workingHoursStart = "09:00";
        }
        if (workingHoursEnd == null || workingHoursEnd.isBlank()) {
            workingHoursEnd = "17:00";
        }
    }

    public WorkingHours workingHours() {
        return new WorkingHours(LocalTime.parse(workingHoursStart), LocalTime.parse(workingHoursEnd));
    }
}
