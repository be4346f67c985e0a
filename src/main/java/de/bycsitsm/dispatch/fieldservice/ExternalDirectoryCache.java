package de.bycsitsm.dispatch.fieldservice;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Time-boxed memo of the field-service platform's team and administrator lists.
 * <p>
 * Both lists change rarely but are needed by every calendar request, so they are
 * fetched at most once per {@link FieldServiceProperties#directoryCacheTtl()}.
 * Each list is held as an immutable snapshot that is replaced as a whole;
 * {@link #invalidate()} forces the next access to refetch.
 */
@Component
public class ExternalDirectoryCache {

    private static final Logger log = LoggerFactory.getLogger(ExternalDirectoryCache.class);

    private final FieldServiceClient client;
    private final Clock clock;
    private final Duration ttl;

    private volatile @Nullable Snapshot<ExternalTeam> teams;
    private volatile @Nullable Snapshot<ExternalAdministrator> administrators;

    public ExternalDirectoryCache(FieldServiceClient client, Clock clock, FieldServiceProperties properties) {
        this.client = client;
        this.clock = clock;
        this.ttl = properties.directoryCacheTtl();
    }

    /**
     * Returns the scheduling teams, keyed by team id.
     *
     * @throws FieldServiceException if the list has to be fetched and the request fails
     */
    public Map<Long, ExternalTeam> teams() {
        var current = teams;
        if (current == null || current.isExpired(clock.instant())) {
            var fetched = client.listTeams();
            log.debug("Cached {} field-service team(s)", fetched.size());
            current = new Snapshot<>(index(fetched, ExternalTeam::id), clock.instant().plus(ttl));
            teams = current;
        }
        return current.byId();
    }

    /**
     * Returns the administrators, keyed by administrator id.
     *
     * @throws FieldServiceException if the list has to be fetched and the request fails
     */
    public Map<Long, ExternalAdministrator> administrators() {
        var current = administrators;
        if (current == null || current.isExpired(clock.instant())) {
            var fetched = client.listAdministrators();
            log.debug("Cached {} field-service administrator(s)", fetched.size());
            current = new Snapshot<>(index(fetched, ExternalAdministrator::id), clock.instant().plus(ttl));
            administrators = current;
        }
        return current.byId();
    }

    public void invalidate() {
        teams = null;
        administrators = null;
        log.info("Field-service directory cache invalidated");
    }

    private static <T> Map<Long, T> index(List<T> items, Function<T, Long> idFunction) {
        return items.stream().collect(Collectors.toMap(idFunction, Function.identity(), (a, b) -> a, HashMap::new));
    }

    private record Snapshot<T>(Map<Long, T> byId, Instant expiresAt) {

        Snapshot {
            byId = Map.copyOf(byId);
        }

        boolean isExpired(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
