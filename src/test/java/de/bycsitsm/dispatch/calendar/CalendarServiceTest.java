package de.bycsitsm.dispatch.calendar;

import de.bycsitsm.dispatch.directory.InMemoryWorkerDirectory;
import de.bycsitsm.dispatch.fieldservice.ExternalDirectoryCache;
import de.bycsitsm.dispatch.fieldservice.FakeFieldServiceClient;
import de.bycsitsm.dispatch.fieldservice.FieldServiceException;
import de.bycsitsm.dispatch.fieldservice.FieldServiceProperties;
import de.bycsitsm.dispatch.fieldservice.ExternalTeam;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CalendarServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-01-01T08:00:00Z"), ZoneOffset.UTC);
    private final InMemoryWorkerDirectory directory = new InMemoryWorkerDirectory()
            .worker(1, "Alex Morgan", 101L)
            .team(10, "Installations", 1);
    private final FakeFieldServiceClient client = new FakeFieldServiceClient()
            .team(4, "North", 101L)
            .administrator(101, "Alex Morgan");
    private final ExternalDirectoryCache cache = new ExternalDirectoryCache(client, clock,
            new FieldServiceProperties("https://isp.example.com", "Basic x", 0, 0, null, false));
    private final InMemoryCalendarRepository repository = new InMemoryCalendarRepository()
            .holiday(1, "New Year", LocalDate.of(2025, 1, 1));
    private final CalendarService service = new CalendarService(
            new CalendarAggregator(directory, repository, client, cache, clock),
            directory, cache, new CalendarProperties(31, 1));

    @Test
    void combined_rejects_missing_query() {
        assertThatThrownBy(() -> service.combined(null))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("must not be empty");
    }

    @Test
    void combined_rejects_range_longer_than_allowed() {
        var range = new DateRange(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 2, 1));

        assertThatThrownBy(() -> service.combined(CalendarQuery.forRange(1, range)))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("at most 31");
    }

    @Test
    void combined_accepts_range_of_exactly_the_maximum() {
        var range = new DateRange(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 1, 31));

        var result = service.combined(CalendarQuery.forRange(1, range));

        assertThat(result.events()).extracting(Event::title).containsExactly("New Year");
    }

    @Test
    void range_requires_both_dates_in_order() {
        assertThatThrownBy(() -> DateRange.of(null, LocalDate.of(2025, 1, 1)))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("required");
        assertThatThrownBy(() -> DateRange.of(LocalDate.of(2025, 1, 2), LocalDate.of(2025, 1, 1)))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("before start date");
    }

    @Test
    void filter_options_list_local_and_external_directory() {
        var options = service.filterOptions(1);

        assertThat(options.workers()).hasSize(1);
        assertThat(options.teams()).hasSize(1);
        assertThat(options.memberships()).hasSize(1);
        assertThat(options.externalTeams()).extracting(ExternalTeam::title).containsExactly("North");
        assertThat(options.externalAdministrators()).hasSize(1);
        assertThat(options.sources()).containsExactly(EventType.values());
        assertThat(options.externalError()).isNull();
    }

    @Test
    void filter_options_report_unreachable_field_service() {
        client.failTeamsWith(new FieldServiceException("Authentication failed"));

        var options = service.filterOptions(1);

        assertThat(options.workers()).hasSize(1);
        assertThat(options.externalTeams()).isEmpty();
        assertThat(options.externalError()).isEqualTo("Authentication failed");
    }

    @Test
    void refresh_external_directory_refetches_on_next_use() {
        service.filterOptions(1);
        service.refreshExternalDirectory();
        service.filterOptions(1);

        assertThat(client.teamCalls()).isEqualTo(2);
    }
}
