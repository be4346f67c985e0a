package de.bycsitsm.dispatch.calendar;

import de.bycsitsm.dispatch.directory.IdentityResolver;
import de.bycsitsm.dispatch.directory.WorkerDirectory;
import de.bycsitsm.dispatch.fieldservice.AssigneeKind;
import de.bycsitsm.dispatch.fieldservice.ExternalAdministrator;
import de.bycsitsm.dispatch.fieldservice.ExternalDirectoryCache;
import de.bycsitsm.dispatch.fieldservice.ExternalTask;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import de.bycsitsm.dispatch.fieldservice.FieldServiceClient;
import de.bycsitsm.dispatch.fieldservice.FieldServiceException;
import de.bycsitsm.dispatch.fieldservice.TaskQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Merges all calendar sources of an organization into one timeline.
 * <p>
 * Sources are read one after another in a fixed order. A source that fails is
 * reported in {@link AggregationMetadata#errors()} and contributes no events;
 * the other sources are unaffected. Records that cannot be normalized are
 * skipped and counted per source.
 */
@Component
public class CalendarAggregator {

    private static final Logger log = LoggerFactory.getLogger(CalendarAggregator.class);

    static final List<EventType> SOURCE_ORDER = List.of(
            EventType.BLOCK,
            EventType.LEAVE,
            EventType.PUBLIC_HOLIDAY,
            EventType.WORK_ITEM,
            EventType.EXTERNAL_TASK);

    private static final Comparator<Event> TIMELINE_ORDER =
            Comparator.comparing(Event::start).thenComparing(Event::id);

    private final WorkerDirectory workerDirectory;
    private final CalendarRepository calendarRepository;
    private final FieldServiceClient fieldServiceClient;
    private final ExternalDirectoryCache externalDirectory;
    private final Clock clock;

    public CalendarAggregator(WorkerDirectory workerDirectory,
                              CalendarRepository calendarRepository,
                              FieldServiceClient fieldServiceClient,
                              ExternalDirectoryCache externalDirectory,
                              Clock clock) {
        this.workerDirectory = workerDirectory;
        this.calendarRepository = calendarRepository;
        this.fieldServiceClient = fieldServiceClient;
        this.externalDirectory = externalDirectory;
        this.clock = clock;
    }

    /**
     * Aggregates the calendar using a fresh snapshot of the organization's worker directory.
     */
    public AggregationResult aggregate(CalendarQuery query) {
        return aggregate(query, IdentityResolver.load(workerDirectory, query.organizationId()));
    }

    public AggregationResult aggregate(CalendarQuery query, IdentityResolver identities) {
        var range = query.range();
        var scope = Scope.of(query, identities);
        var normalizer = new EventNormalizer(identities);

        var events = new ArrayList<Event>();
        var seenIds = new HashSet<String>();
        var counts = new EnumMap<EventType, Integer>(EventType.class);
        var skipped = new EnumMap<EventType, Integer>(EventType.class);
        var errors = new EnumMap<EventType, String>(EventType.class);

        for (var type : SOURCE_ORDER) {
            if (!query.includes(type)) {
                continue;
            }
            try {
                var batch = switch (type) {
                    case BLOCK -> Batch.of(
                            calendarRepository.findBlocks(query.organizationId(), range, scope.workerIds()),
                            normalizer::normalizeBlock);
                    case LEAVE -> Batch.of(
                            calendarRepository.findApprovedLeave(query.organizationId(), range, scope.workerIds())
                                    .stream()
                                    .filter(LeaveRequest::isApproved)
                                    .toList(),
                            normalizer::normalizeLeave);
                    case PUBLIC_HOLIDAY -> Batch.of(
                            calendarRepository.findPublicHolidays(query.organizationId(), range),
                            normalizer::normalizePublicHoliday);
                    case WORK_ITEM -> Batch.of(
                            calendarRepository.findWorkItems(query.organizationId(), range,
                                    scope.workerIds(), scope.teamIds()),
                            normalizer::normalizeWorkItem);
                    case EXTERNAL_TASK -> fetchExternalTasks(query, scope, identities);
                };

                var added = 0;
                for (var event : batch.events()) {
                    if (!event.overlaps(range)) {
                        continue;
                    }
                    if (!seenIds.add(event.id())) {
                        log.debug("Skipping duplicate event {}", event.id());
                        continue;
                    }
                    events.add(event.clippedTo(range));
                    added++;
                }
                counts.put(type, added);
                if (batch.skipped() > 0) {
                    skipped.put(type, batch.skipped());
                    log.warn("Skipped {} malformed {} record(s)", batch.skipped(), type.key());
                }
            } catch (RuntimeException e) {
                var message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
                log.warn("Calendar source {} failed for organization {}: {}",
                        type.key(), query.organizationId(), message);
                errors.put(type, message);
            }
        }

        events.sort(TIMELINE_ORDER);
        var metadata = new AggregationMetadata(
                range,
                LocalDateTime.now(clock),
                counts,
                skipped,
                errors,
                query.describeFilters(),
                events.size());
        return new AggregationResult(events, metadata);
    }

    private Batch fetchExternalTasks(CalendarQuery query, Scope scope, IdentityResolver identities) {
        var range = query.range();
        var teams = externalTeams(query);
        var administrators = externalAdministrators();

        Set<Long> adminIds = null;
        Set<Long> teamIds = null;
        if (scope.restricted() || query.hasExternalFilter()) {
            adminIds = new LinkedHashSet<>(identities.resolveExternalAdminIds(
                    scope.workerIds() != null ? scope.workerIds() : Set.of(),
                    query.externalAdminIds()));
            for (var teamId : query.externalTeamIds()) {
                var team = teams.get(teamId);
                if (team == null) {
                    log.debug("Unknown field-service team {} in filter", teamId);
                    continue;
                }
                adminIds.addAll(team.memberIds());
            }
            if (adminIds.isEmpty() && query.externalTeamIds().isEmpty()) {
                log.debug("Filters resolve to no field-service administrator; skipping external tasks");
                return Batch.empty();
            }
            teamIds = new LinkedHashSet<>(query.externalTeamIds());
            for (var team : teams.values()) {
                if (team.memberIds().stream().anyMatch(adminIds::contains)) {
                    teamIds.add(team.id());
                }
            }
        }

        var tasks = new LinkedHashMap<String, ExternalTask>();
        var withoutId = new ArrayList<ExternalTask>();
        Consumer<ExternalTask> collect = task -> {
            if (task.id() == null) {
                withoutId.add(task);
            } else {
                tasks.putIfAbsent(task.id(), task);
            }
        };
        if (adminIds != null && adminIds.size() == 1 && query.externalTeamIds().isEmpty()) {
            fieldServiceClient.listTasks(TaskQuery.forAdministrator(adminIds.iterator().next())).forEach(collect);
            for (var teamId : teamIds) {
                fieldServiceClient.listTasks(TaskQuery.forTeam(teamId)).forEach(collect);
            }
        } else {
            fieldServiceClient.listTasks(TaskQuery.all()).forEach(collect);
        }

        var received = new ArrayList<>(tasks.values());
        received.addAll(withoutId);
        var matching = new ArrayList<ExternalTask>();
        for (var task : received) {
            if (adminIds == null || isAssignedTo(task, adminIds, teamIds)) {
                matching.add(task);
            }
        }

        var normalizer = new EventNormalizer(identities, administrators, teams);
        var batch = Batch.of(matching, normalizer::normalizeExternalTask);
        var inRange = batch.events().stream()
                .filter(event -> range.contains(event.start().toLocalDate()))
                .toList();
        log.debug("Field-service returned {} task(s), {} in range {}", received.size(), inRange.size(), range);
        return new Batch(inRange, batch.skipped());
    }

    private static boolean isAssignedTo(ExternalTask task, Set<Long> adminIds, @Nullable Set<Long> teamIds) {
        var assigneeId = task.assigneeId();
        if (assigneeId == null) {
            return false;
        }
        if (task.assigneeKind() == AssigneeKind.ADMINISTRATOR) {
            return adminIds.contains(assigneeId);
        }
        return task.assigneeKind() == AssigneeKind.TEAM && teamIds != null && teamIds.contains(assigneeId);
    }

    /**
     * Team list for ownership and filtering. Without an external team filter a
     * failing team list only costs the team-assigned tasks.
     */
    private Map<Long, ExternalTeam> externalTeams(CalendarQuery query) {
        if (!query.externalTeamIds().isEmpty()) {
            return externalDirectory.teams();
        }
        try {
            return externalDirectory.teams();
        } catch (FieldServiceException e) {
            log.warn("Field-service teams unavailable, team-assigned tasks may be missing: {}", e.getMessage());
            return Map.of();
        }
    }

    private Map<Long, ExternalAdministrator> externalAdministrators() {
        try {
            return externalDirectory.administrators();
        } catch (FieldServiceException e) {
            log.warn("Field-service administrators unavailable, using ids as owner names: {}", e.getMessage());
            return Map.of();
        }
    }

    /**
     * The local worker and team restriction of a query. {@code null} sets are unrestricted;
     * a supplied filter that resolves to nobody yields empty sets.
     */
    private record Scope(@Nullable Set<Long> workerIds, @Nullable Set<Long> teamIds) {

        static Scope of(CalendarQuery query, IdentityResolver identities) {
            if (!query.hasWorkerFilter()) {
                return new Scope(null, null);
            }
            return new Scope(
                    identities.resolveEffectiveWorkerIds(query.workerIds(), query.teamIds()),
                    query.teamIds());
        }

        boolean restricted() {
            return workerIds != null;
        }
    }

    private record Batch(List<Event> events, int skipped) {

        static Batch empty() {
            return new Batch(List.of(), 0);
        }

        static <T> Batch of(List<T> records, Function<T, Event> normalize) {
            var events = new ArrayList<Event>(records.size());
            var skipped = 0;
            for (var item : records) {
                try {
                    events.add(normalize.apply(item));
                } catch (MalformedRecordException e) {
                    log.debug("Malformed record: {}", e.getMessage());
                    skipped++;
                }
            }
            return new Batch(events, skipped);
        }
    }
}
