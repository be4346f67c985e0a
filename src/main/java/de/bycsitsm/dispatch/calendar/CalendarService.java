package de.bycsitsm.dispatch.calendar;

import de.bycsitsm.dispatch.directory.IdentityResolver;
import de.bycsitsm.dispatch.directory.WorkerDirectory;
import de.bycsitsm.dispatch.fieldservice.ExternalAdministrator;
import de.bycsitsm.dispatch.fieldservice.ExternalDirectoryCache;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import de.bycsitsm.dispatch.fieldservice.FieldServiceException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Service layer for the combined calendar. Validates requests and delegates
 * to {@link CalendarAggregator}.
 */
@Service
public class CalendarService {

    private static final Logger log = LoggerFactory.getLogger(CalendarService.class);

    private final CalendarAggregator aggregator;
    private final WorkerDirectory workerDirectory;
    private final ExternalDirectoryCache externalDirectory;
    private final CalendarProperties properties;

    CalendarService(CalendarAggregator aggregator, WorkerDirectory workerDirectory,
                    ExternalDirectoryCache externalDirectory, CalendarProperties properties) {
        this.aggregator = aggregator;
        this.workerDirectory = workerDirectory;
        this.externalDirectory = externalDirectory;
        this.properties = properties;
    }

    /**
     * Returns the combined calendar for the query. Failing sources are reported
     * in the result's metadata instead of failing the request.
     *
     * @param query the range, filters and sources to read
     * @return the events of all readable sources, sorted by start
     * @throws CalendarQueryException if the query is missing or its range is too long
     */
    public AggregationResult combined(CalendarQuery query) {
        if (query == null) {
            throw new CalendarQueryException("Calendar query must not be empty.");
        }
        properties.checkRange(query.range());

        log.info("Aggregating calendar for organization {} over {} (filters {})",
                query.organizationId(), query.range(), query.describeFilters());
        var result = aggregator.aggregate(query);
        if (result.metadata().hasErrors()) {
            log.info("Aggregated {} event(s) for organization {}; failed sources: {}",
                    result.events().size(), query.organizationId(), result.metadata().errors().keySet());
        } else {
            log.info("Aggregated {} event(s) for organization {}", result.events().size(), query.organizationId());
        }
        return result;
    }

    /**
     * Lists the workers, teams and sources the combined calendar can be filtered by.
     * The field-service lists are left empty, with the reason attached, if the
     * platform cannot be reached.
     */
    public CalendarFilterOptions filterOptions(long organizationId) {
        var identities = IdentityResolver.load(workerDirectory, organizationId);

        List<ExternalTeam> externalTeams = List.of();
        List<ExternalAdministrator> administrators = List.of();
        @Nullable String externalError = null;
        try {
            externalTeams = externalDirectory.teams().values().stream()
                    .sorted(Comparator.comparing(ExternalTeam::title, String.CASE_INSENSITIVE_ORDER))
                    .toList();
            administrators = externalDirectory.administrators().values().stream()
                    .filter(ExternalAdministrator::active)
                    .sorted(Comparator.comparing(ExternalAdministrator::displayName, String.CASE_INSENSITIVE_ORDER))
                    .toList();
        } catch (FieldServiceException e) {
            log.warn("Field-service directory unavailable for filter options: {}", e.getMessage());
            externalError = e.getMessage();
        }

        return new CalendarFilterOptions(
                identities.workers(),
                identities.teams(),
                identities.memberships(),
                externalTeams,
                administrators,
                List.of(EventType.values()),
                externalError);
    }

    /**
     * Drops the cached field-service team and administrator lists so the next
     * request reads them again.
     */
    public void refreshExternalDirectory() {
        externalDirectory.invalidate();
    }
}
