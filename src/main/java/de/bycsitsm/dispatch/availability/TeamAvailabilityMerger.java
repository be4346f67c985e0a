package de.bycsitsm.dispatch.availability;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines the slots of several team members: a team slot exists wherever at
 * least one member is free, and lists exactly the members who are.
 */
@Component
public class TeamAvailabilityMerger {

    public List<Slot> merge(Map<Long, List<Slot>> slotsPerMember) {
        var firstByStart = new TreeMap<LocalDateTime, Slot>();
        var membersByStart = new TreeMap<LocalDateTime, TreeSet<Long>>();

        slotsPerMember.forEach((memberId, slots) -> {
            for (var slot : slots) {
                firstByStart.putIfAbsent(slot.start(), slot);
                membersByStart.computeIfAbsent(slot.start(), start -> new TreeSet<>()).add(memberId);
            }
        });

        var merged = new ArrayList<Slot>(firstByStart.size());
        firstByStart.forEach((start, slot) ->
                merged.add(slot.withFreeMembers(List.copyOf(membersByStart.get(start)))));
        return merged;
    }
}
