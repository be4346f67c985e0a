package de.bycsitsm.dispatch.calendar;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Optional;

/**
 * The source an {@link Event} was derived from. Each source prefixes the ids of
 * its events, so the source can be recovered from an event id alone.
 */
public enum EventType {
    EXTERNAL_TASK("external_task", "external-task-", "#3B82F6", EventOrigin.EXTERNAL),
    WORK_ITEM("work_item", "work-item-", "#8B5CF6", EventOrigin.LOCAL),
    LEAVE("leave", "leave-", "#22C55E", EventOrigin.LOCAL),
    PUBLIC_HOLIDAY("public_holiday", "public-holiday-", "#10B981", EventOrigin.LOCAL),
    BLOCK("block", "block-", "#F97316", EventOrigin.LOCAL);

    private final String key;
    private final String idPrefix;
    private final String defaultColor;
    private final EventOrigin origin;

    EventType(String key, String idPrefix, String defaultColor, EventOrigin origin) {
        this.key = key;
        this.idPrefix = idPrefix;
        this.defaultColor = defaultColor;
        this.origin = origin;
    }

    /**
     * The type tag used in responses and metadata keys (e.g. {@code public_holiday}).
     */
    public String key() {
        return key;
    }

    public String defaultColor() {
        return defaultColor;
    }

    public EventOrigin origin() {
        return origin;
    }

    public String eventId(Object recordId) {
        return idPrefix + recordId;
    }

    /**
     * Recovers the source of an event from its id. The longest matching prefix wins.
     */
    public static Optional<EventType> fromEventId(String eventId) {
        return Arrays.stream(values())
                .filter(type -> eventId.startsWith(type.idPrefix) && eventId.length() > type.idPrefix.length())
                .max(Comparator.comparingInt(type -> type.idPrefix.length()));
    }
}
