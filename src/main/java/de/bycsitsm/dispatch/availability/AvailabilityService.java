package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarAggregator;
import de.bycsitsm.dispatch.calendar.CalendarProperties;
import de.bycsitsm.dispatch.calendar.CalendarQuery;
import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import de.bycsitsm.dispatch.calendar.DateRange;
import de.bycsitsm.dispatch.calendar.Event;
import de.bycsitsm.dispatch.calendar.EventType;
import de.bycsitsm.dispatch.directory.IdentityResolver;
import de.bycsitsm.dispatch.directory.WorkerDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Service layer for slot search. Collects the busy times of workers from the
 * calendar sources and hands them to {@link SlotGenerator}.
 * <p>
 * Work-item due dates are not busy time. A calendar source that cannot be read
 * is logged and ignored, so slot search never fails because of it.
 */
@Service
public class AvailabilityService {

    private static final Logger log = LoggerFactory.getLogger(AvailabilityService.class);

    static final Set<EventType> BUSY_SOURCES =
            Set.of(EventType.EXTERNAL_TASK, EventType.LEAVE, EventType.PUBLIC_HOLIDAY, EventType.BLOCK);

    private final WorkerDirectory workerDirectory;
    private final CalendarAggregator aggregator;
    private final SlotGenerator slotGenerator;
    private final TeamAvailabilityMerger merger;
    private final CalendarProperties calendarProperties;
    private final AvailabilityProperties availabilityProperties;

    AvailabilityService(WorkerDirectory workerDirectory, CalendarAggregator aggregator, SlotGenerator slotGenerator,
                        TeamAvailabilityMerger merger, CalendarProperties calendarProperties,
                        AvailabilityProperties availabilityProperties) {
        this.workerDirectory = workerDirectory;
        this.aggregator = aggregator;
        this.slotGenerator = slotGenerator;
        this.merger = merger;
        this.calendarProperties = calendarProperties;
        this.availabilityProperties = availabilityProperties;
    }

    /**
     * Finds the free slots of one worker.
     *
     * @param organizationId  the worker's organization
     * @param workerId        the local worker id
     * @param range           the days to search
     * @param durationMinutes the length of the work
     * @param travelMinutes   travel time before and after the work
     * @return the free slots, ordered by start
     * @throws CalendarQueryException if the request is invalid or the worker is unknown
     */
    public List<Slot> availabilityForWorker(long organizationId, long workerId, DateRange range,
                                            int durationMinutes, int travelMinutes) {
        var request = slotRequest(range, durationMinutes, travelMinutes);
        var identities = IdentityResolver.load(workerDirectory, organizationId);
        var worker = identities.findWorker(workerId)
                .orElseThrow(() -> new CalendarQueryException("Unknown worker " + workerId + "."));

        if (workerDirectory.getWorkerExternalMapping(workerId).isEmpty()) {
            log.info("Worker {} has no field-service mapping; only local commitments are considered", workerId);
        }

        log.info("Searching slots for worker {} over {} ({} min + 2 x {} min travel)",
                worker.displayName(), range, durationMinutes, travelMinutes);
        var slots = slotsFor(organizationId, workerId, request, identities);
        log.info("Found {} free slot(s) for worker {}", slots.size(), workerId);
        return slots;
    }

    /**
     * Finds the slots in which at least one member of a local team is free.
     * An unknown or empty team has no slots.
     *
     * @throws CalendarQueryException if the request is invalid
     */
    public TeamAvailability availabilityForTeam(long organizationId, long teamId, DateRange range,
                                                int durationMinutes, int travelMinutes) {
        var request = slotRequest(range, durationMinutes, travelMinutes);
        var identities = IdentityResolver.load(workerDirectory, organizationId);
        var team = identities.findTeam(teamId);
        if (team.isEmpty()) {
            log.info("Team {} not found in organization {}", teamId, organizationId);
            return TeamAvailability.EMPTY;
        }

        var members = identities.teamMembers(teamId);
        log.info("Searching slots for team {} ({} member(s)) over {}", team.get().name(), members.size(), range);

        var perMember = new LinkedHashMap<Long, List<Slot>>();
        for (var memberId : members) {
            perMember.put(memberId, slotsFor(organizationId, memberId, request, identities));
        }
        var slots = merger.merge(perMember);
        log.info("Found {} team slot(s) for team {}", slots.size(), teamId);
        return new TeamAvailability(slots, perMember);
    }

    private SlotRequest slotRequest(DateRange range, int durationMinutes, int travelMinutes) {
        if (range == null) {
            throw new CalendarQueryException("Start date and end date are required.");
        }
        calendarProperties.checkRange(range);
        return new SlotRequest(range, durationMinutes, travelMinutes, availabilityProperties.workingHours());
    }

    private List<Slot> slotsFor(long organizationId, long workerId, SlotRequest request, IdentityResolver identities) {
        var query = CalendarQuery.forRange(organizationId, request.range())
                .withWorkers(Set.of(workerId))
                .withSources(BUSY_SOURCES);
        var result = aggregator.aggregate(query, identities);
        result.metadata().errors().forEach((source, message) ->
                log.warn("Ignoring unavailable source {} for worker {}: {}", source.key(), workerId, message));

        var busy = result.events().stream()
                .filter(Event::blocksAvailability)
                .map(BusyInterval::of)
                .toList();
        return slotGenerator.generate(request, busy);
    }
}
