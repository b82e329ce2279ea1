package com.dividendcapture.unit.calendar;

import static org.assertj.core.api.Assertions.assertThat;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.HolidayCalendarConfig;
import com.dividendcapture.unit.TestCalendars;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for BusinessDayCalendar covering weekends, exchange holidays, year-end
 * closures and signed business-day arithmetic.
 */
class BusinessDayCalendarTest {

    private BusinessDayCalendar calendar;

    @BeforeEach
    void setUp() {
        calendar = TestCalendars.tse2023();
    }

    @Nested
    @DisplayName("Business Day Detection")
    class BusinessDayDetection {

        @Test
        @DisplayName("Regular weekday is a business day")
        void weekdayIsBusinessDay() {
            assertThat(calendar.isBusinessDay(LocalDate.of(2023, 3, 20))).isTrue();
        }

        @Test
        @DisplayName("Weekends are not business days")
        void weekendsAreNotBusinessDays() {
            assertThat(calendar.isBusinessDay(LocalDate.of(2023, 3, 18))).isFalse();
            assertThat(calendar.isBusinessDay(LocalDate.of(2023, 3, 19))).isFalse();
        }

        @Test
        @DisplayName("Configured holiday is not a business day")
        void holidayIsNotBusinessDay() {
            // Tuesday, Vernal Equinox Day
            assertThat(calendar.isBusinessDay(LocalDate.of(2023, 3, 21))).isFalse();
        }

        @Test
        @DisplayName("Year-end closure days are closed every year regardless of holiday list")
        void yearEndClosuresApplyEveryYear() {
            assertThat(calendar.isBusinessDay(LocalDate.of(2023, 12, 29))).isTrue();
            assertThat(calendar.isBusinessDay(LocalDate.of(2024, 1, 2))).isFalse();
            assertThat(calendar.isBusinessDay(LocalDate.of(2024, 1, 3))).isFalse();
            assertThat(calendar.isBusinessDay(LocalDate.of(2025, 12, 31))).isFalse();
            assertThat(calendar.isBusinessDay(LocalDate.of(2024, 1, 4))).isTrue();
        }

        @Test
        @DisplayName("Empty holiday list still closes weekends and year-end days")
        void emptyHolidayList() {
            HolidayCalendarConfig config = new HolidayCalendarConfig();
            config.setHolidays(new ArrayList<>());
            BusinessDayCalendar bare = new BusinessDayCalendar(config);

            assertThat(bare.isBusinessDay(LocalDate.of(2023, 3, 21))).isTrue();
            assertThat(bare.isBusinessDay(LocalDate.of(2023, 12, 31))).isFalse();
        }
    }

    @Nested
    @DisplayName("Adding Business Days")
    class AddBusinessDays {

        @Test
        @DisplayName("Zero returns the date unchanged, even on a weekend")
        void zeroIsIdentity() {
            LocalDate saturday = LocalDate.of(2023, 3, 18);
            assertThat(calendar.addBusinessDays(saturday, 0)).isEqualTo(saturday);
        }

        @Test
        @DisplayName("Forward skips weekend")
        void forwardSkipsWeekend() {
            assertThat(calendar.addBusinessDays(LocalDate.of(2023, 3, 17), 1)).isEqualTo(LocalDate.of(2023, 3, 20));
        }

        @Test
        @DisplayName("Forward skips holiday")
        void forwardSkipsHoliday() {
            assertThat(calendar.addBusinessDays(LocalDate.of(2023, 3, 20), 1)).isEqualTo(LocalDate.of(2023, 3, 22));
        }

        @Test
        @DisplayName("Backward skips holiday and weekend")
        void backwardSkipsHolidayAndWeekend() {
            assertThat(calendar.addBusinessDays(LocalDate.of(2023, 3, 22), -2)).isEqualTo(LocalDate.of(2023, 3, 17));
        }

        @Test
        @DisplayName("Forward across the year-end closure")
        void forwardAcrossYearEnd() {
            assertThat(calendar.addBusinessDays(LocalDate.of(2023, 12, 29), 1)).isEqualTo(LocalDate.of(2024, 1, 4));
        }

        @Test
        @DisplayName("Previous and next business day around a holiday")
        void previousAndNext() {
            assertThat(calendar.previousBusinessDay(LocalDate.of(2023, 3, 22))).isEqualTo(LocalDate.of(2023, 3, 20));
            assertThat(calendar.nextBusinessDay(LocalDate.of(2023, 3, 20))).isEqualTo(LocalDate.of(2023, 3, 22));
            assertThat(calendar.onOrAfter(LocalDate.of(2023, 3, 21))).isEqualTo(LocalDate.of(2023, 3, 22));
            assertThat(calendar.onOrAfter(LocalDate.of(2023, 3, 22))).isEqualTo(LocalDate.of(2023, 3, 22));
        }
    }

    @Nested
    @DisplayName("Business Days Between")
    class BusinessDaysBetween {

        @Test
        @DisplayName("Counts business days after the start up to and including the end")
        void countsForward() {
            // 3/20 and 3/22; 3/18-19 weekend, 3/21 holiday
            assertThat(calendar.businessDaysBetween(LocalDate.of(2023, 3, 17), LocalDate.of(2023, 3, 22)))
                    .isEqualTo(2);
        }

        @Test
        @DisplayName("Sign flips when the start is after the end")
        void signFlips() {
            assertThat(calendar.businessDaysBetween(LocalDate.of(2023, 3, 22), LocalDate.of(2023, 3, 17)))
                    .isEqualTo(-2);
        }

        @Test
        @DisplayName("Same date yields zero")
        void sameDate() {
            LocalDate day = LocalDate.of(2023, 3, 20);
            assertThat(calendar.businessDaysBetween(day, day)).isZero();
        }

        @Test
        @DisplayName("Is the inverse of addBusinessDays from a business day")
        void inverseOfAdd() {
            LocalDate start = LocalDate.of(2023, 3, 1);
            LocalDate end = calendar.addBusinessDays(start, 20);
            assertThat(calendar.businessDaysBetween(start, end)).isEqualTo(20);
        }

        @Test
        @DisplayName("Full March 2023 from the 1st counts 21 business days")
        void fullMonth() {
            assertThat(calendar.businessDaysBetween(LocalDate.of(2023, 3, 1), LocalDate.of(2023, 3, 31)))
                    .isEqualTo(21);
        }
    }

    @Test
    @DisplayName("Range lists business days inclusive of both ends, in order")
    void businessDaysInRange() {
        List<LocalDate> days = calendar.businessDaysInRange(LocalDate.of(2023, 12, 28), LocalDate.of(2024, 1, 5));
        assertThat(days).containsExactly(
                LocalDate.of(2023, 12, 28),
                LocalDate.of(2023, 12, 29),
                LocalDate.of(2024, 1, 4),
                LocalDate.of(2024, 1, 5));
    }
}
