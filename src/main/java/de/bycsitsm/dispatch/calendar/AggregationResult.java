package de.bycsitsm.dispatch.calendar;

import java.util.List;

/**
 * The combined calendar: events sorted by start, then id.
 */
public record AggregationResult(List<Event> events, AggregationMetadata metadata) {

    public AggregationResult {
        events = List.copyOf(events);
    }
}
