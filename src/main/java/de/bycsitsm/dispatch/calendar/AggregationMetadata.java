package de.bycsitsm.dispatch.calendar;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Describes how an {@link AggregationResult} was produced.
 *
 * @param range          the requested range
 * @param generatedAt    when the aggregation ran
 * @param counts         number of events contributed per source that was read
 * @param skipped        number of malformed records skipped per source
 * @param errors         failure message per source that could not be read
 * @param filtersApplied the filters of the query
 * @param totalEvents    the number of events in the result
 */
public record AggregationMetadata(
        DateRange range,
        LocalDateTime generatedAt,
        Map<EventType, Integer> counts,
        Map<EventType, Integer> skipped,
        Map<EventType, String> errors,
        Set<String> filtersApplied,
        int totalEvents
) {

    public AggregationMetadata {
        counts = Map.copyOf(counts);
        skipped = Map.copyOf(skipped);
        errors = Map.copyOf(errors);
        filtersApplied = Set.copyOf(filtersApplied);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
