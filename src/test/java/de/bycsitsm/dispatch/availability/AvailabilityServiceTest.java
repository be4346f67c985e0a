package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarAggregator;
import de.bycsitsm.dispatch.calendar.CalendarBlock;
import de.bycsitsm.dispatch.calendar.CalendarProperties;
import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import de.bycsitsm.dispatch.calendar.DateRange;
import de.bycsitsm.dispatch.calendar.InMemoryCalendarRepository;
import de.bycsitsm.dispatch.calendar.LeaveStatus;
import de.bycsitsm.dispatch.directory.InMemoryWorkerDirectory;
import de.bycsitsm.dispatch.fieldservice.ExternalDirectoryCache;
import de.bycsitsm.dispatch.fieldservice.FakeFieldServiceClient;
import de.bycsitsm.dispatch.fieldservice.FieldServiceException;
import de.bycsitsm.dispatch.fieldservice.FieldServiceProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static de.bycsitsm.dispatch.fieldservice.FakeFieldServiceClient.adminTask;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilityServiceTest {

    private static final LocalDate MONDAY = LocalDate.of(2025, 1, 6);
    private static final LocalDate TUESDAY = MONDAY.plusDays(1);
    private static final LocalDate WEDNESDAY = MONDAY.plusDays(2);
    private static final LocalDate THURSDAY = MONDAY.plusDays(3);
    private static final DateRange RANGE = new DateRange(MONDAY, THURSDAY);

    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T08:00:00Z"), ZoneOffset.UTC);

    private final InMemoryWorkerDirectory directory = new InMemoryWorkerDirectory()
            .worker(1, "Alex Morgan", 101L)
            .worker(2, "Sam Patel", 102L)
            .worker(3, "Robin Keller", null)
            .team(10, "Installations", 1, 2)
            .team(11, "Empty");

    private final FakeFieldServiceClient client = new FakeFieldServiceClient()
            .task(adminTask("t1", "2025-01-06 09:00:00", 90, 101));

    private final InMemoryCalendarRepository repository = new InMemoryCalendarRepository()
            .leave(1, 2, TUESDAY, TUESDAY, LeaveStatus.APPROVED)
            .leave(2, 1, TUESDAY, TUESDAY, LeaveStatus.PENDING)
            .holiday(1, "Staff day", WEDNESDAY)
            .workItem(1, MONDAY, 1L, null)
            .block(new CalendarBlock(1, 1, "Focus", "other", null, THURSDAY.atTime(9, 0), THURSDAY.atTime(17, 0),
                    false, null, false, false, null));

    private AvailabilityService service() {
        var cache = new ExternalDirectoryCache(client, clock,
                new FieldServiceProperties("https://isp.example.com", "Basic x", 0, 0, null, false));
        var aggregator = new CalendarAggregator(directory, repository, client, cache, clock);
        return new AvailabilityService(directory, aggregator, new SlotGenerator(clock), new TeamAvailabilityMerger(),
                new CalendarProperties(31, 1), new AvailabilityProperties(null, null));
    }

    private static List<Slot> on(List<Slot> slots, LocalDate day) {
        return slots.stream().filter(slot -> slot.start().toLocalDate().equals(day)).toList();
    }

    @Test
    void field_service_task_blocks_its_time() {
        var slots = service().availabilityForWorker(1, 1, RANGE, 60, 0);

        var monday = on(slots, MONDAY);
        assertThat(monday).hasSize(12);
        assertThat(monday.get(0).start()).isEqualTo(MONDAY.atTime(10, 30));
    }

    @Test
    void work_items_and_non_blocking_blocks_leave_the_worker_free() {
        var slots = service().availabilityForWorker(1, 1, RANGE, 60, 0);

        assertThat(on(slots, MONDAY)).isNotEmpty();
        assertThat(on(slots, THURSDAY)).hasSize(15);
    }

    @Test
    void only_approved_leave_blocks() {
        assertThat(on(service().availabilityForWorker(1, 1, RANGE, 60, 0), TUESDAY)).hasSize(15);
        assertThat(on(service().availabilityForWorker(1, 2, RANGE, 60, 0), TUESDAY)).isEmpty();
    }

    @Test
    void public_holiday_blocks_everyone() {
        assertThat(on(service().availabilityForWorker(1, 1, RANGE, 60, 0), WEDNESDAY)).isEmpty();
        assertThat(on(service().availabilityForWorker(1, 3, RANGE, 60, 0), WEDNESDAY)).isEmpty();
    }

    @Test
    void unmapped_worker_is_judged_by_local_commitments() {
        var slots = service().availabilityForWorker(1, 3, RANGE, 60, 0);

        assertThat(on(slots, MONDAY)).hasSize(15);
    }

    @Test
    void unreachable_field_service_does_not_fail_slot_search() {
        client.failWith(new FieldServiceException("Connection refused"));

        var slots = service().availabilityForWorker(1, 1, RANGE, 60, 0);

        assertThat(on(slots, MONDAY)).hasSize(15);
    }

    @Test
    void unknown_worker_is_rejected() {
        assertThatThrownBy(() -> service().availabilityForWorker(1, 99, RANGE, 60, 0))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessage("Unknown worker 99.");
    }

    @Test
    void invalid_durations_are_rejected() {
        assertThatThrownBy(() -> service().availabilityForWorker(1, 1, RANGE, 0, 0))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("Duration must be positive");
        assertThatThrownBy(() -> service().availabilityForWorker(1, 1, RANGE, 60, -5))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("Travel time must not be negative");
    }

    @Test
    void too_long_range_is_rejected() {
        var range = new DateRange(MONDAY, MONDAY.plusDays(40));

        assertThatThrownBy(() -> service().availabilityForTeam(1, 10, range, 60, 0))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("at most 31");
    }

    @Test
    void team_slots_list_the_free_members() {
        var availability = service().availabilityForTeam(1, 10, RANGE, 60, 0);

        assertThat(availability.perMember().keySet()).containsExactly(1L, 2L);
        var monday = on(availability.slots(), MONDAY);
        assertThat(monday).hasSize(15);
        assertThat(monday.get(0).freeMembers()).containsExactly(2L);
        assertThat(monday.get(3).freeMembers()).containsExactly(1L, 2L);
        assertThat(on(availability.slots(), TUESDAY)).allMatch(slot -> slot.freeMembers().equals(List.of(1L)));
        assertThat(on(availability.slots(), WEDNESDAY)).isEmpty();
    }

    @Test
    void per_member_slots_keep_team_order() {
        directory.team(12, "Reversed", 2, 3, 1);

        var availability = service().availabilityForTeam(1, 12, RANGE, 60, 0);

        assertThat(availability.perMember().keySet()).containsExactly(2L, 3L, 1L);
    }

    @Test
    void unknown_or_empty_team_has_no_slots() {
        assertThat(service().availabilityForTeam(1, 99, RANGE, 60, 0)).isEqualTo(TeamAvailability.EMPTY);
        assertThat(service().availabilityForTeam(1, 11, RANGE, 60, 0).slots()).isEmpty();
    }
}
