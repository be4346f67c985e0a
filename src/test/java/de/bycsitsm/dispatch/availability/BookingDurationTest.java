package de.bycsitsm.dispatch.availability;

import de.bycsitsm.dispatch.calendar.CalendarQueryException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingDurationTest {

    @Test
    void hours_and_minutes_are_combined() {
        assertThat(BookingDuration.parseMinutes("2h 30m")).isEqualTo(150);
        assertThat(BookingDuration.parseMinutes("1H30M")).isEqualTo(90);
        assertThat(BookingDuration.parseMinutes(" 1h ")).isEqualTo(60);
        assertThat(BookingDuration.parseMinutes("90m")).isEqualTo(90);
    }

    @Test
    void plain_number_is_minutes() {
        assertThat(BookingDuration.parseMinutes("45")).isEqualTo(45);
    }

    @Test
    void empty_text_is_rejected() {
        assertThatThrownBy(() -> BookingDuration.parseMinutes(""))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("must not be empty");
        assertThatThrownBy(() -> BookingDuration.parseMinutes(null))
                .isInstanceOf(CalendarQueryException.class);
    }

    @Test
    void unreadable_text_is_rejected() {
        assertThatThrownBy(() -> BookingDuration.parseMinutes("two hours"))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("Invalid duration 'two hours'");
        assertThatThrownBy(() -> BookingDuration.parseMinutes("30m 1h"))
                .isInstanceOf(CalendarQueryException.class);
    }

    @Test
    void zero_duration_is_rejected() {
        assertThatThrownBy(() -> BookingDuration.parseMinutes("0"))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("must be positive");
        assertThatThrownBy(() -> BookingDuration.parseMinutes("0h 0m"))
                .isInstanceOf(CalendarQueryException.class);
    }

    @Test
    void oversized_numbers_are_rejected_instead_of_overflowing() {
        assertThatThrownBy(() -> BookingDuration.parseMinutes("99999999999"))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("Invalid duration");
        assertThatThrownBy(() -> BookingDuration.parseMinutes("71582789h"))
                .isInstanceOf(CalendarQueryException.class)
                .hasMessageContaining("Invalid duration");
        assertThatThrownBy(() -> BookingDuration.parseMinutes("1h 123456m"))
                .isInstanceOf(CalendarQueryException.class);
    }

    @Test
    void largest_accepted_numbers_stay_exact() {
        assertThat(BookingDuration.parseMinutes("99999")).isEqualTo(99_999);
        assertThat(BookingDuration.parseMinutes("99999h 99999m")).isEqualTo(99_999 * 60 + 99_999);
    }
}
