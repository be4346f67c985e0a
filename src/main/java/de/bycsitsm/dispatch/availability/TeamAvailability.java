package de.bycsitsm.dispatch.availability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Free slots of a team.
 *
 * @param slots     every slot in which at least one member is free, annotated with the free members
 * @param perMember each member's own slots, keyed by worker id in team order
 */
public record TeamAvailability(List<Slot> slots, Map<Long, List<Slot>> perMember) {

    public static final TeamAvailability EMPTY = new TeamAvailability(List.of(), Map.of());

    public TeamAvailability {
        slots = List.copyOf(slots);
        var copy = new LinkedHashMap<Long, List<Slot>>();
        perMember.forEach((memberId, memberSlots) -> copy.put(memberId, List.copyOf(memberSlots)));
        perMember = Collections.unmodifiableMap(copy);
    }
}
