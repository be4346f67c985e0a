package de.bycsitsm.dispatch.calendar;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for combined-calendar requests.
 *
 * @param maxRangeDays   the longest range, in days, a single request may cover
 * @param organizationId the organization the planner views work on
 */
@ConfigurationProperties(prefix = "dispatch.calendar")
public record CalendarProperties(int maxRangeDays, long organizationId) {

    public CalendarProperties {
        if (maxRangeDays <= 0) {
            maxRangeDays = 92;
        }
        if (organizationId <= 0) {
            organizationId = 1;
        }
    }

    /**
     * @throws CalendarQueryException if the range is longer than allowed
     */
    public void checkRange(DateRange range) {
        if (range.lengthInDays() > maxRangeDays) {
            throw new CalendarQueryException("Date range " + range + " spans " + range.lengthInDays()
                    + " days; at most " + maxRangeDays + " are allowed.");
        }
    }
}
