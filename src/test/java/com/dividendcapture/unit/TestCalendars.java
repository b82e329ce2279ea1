package com.dividendcapture.unit;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.calendar.HolidayCalendarConfig;
import com.dividendcapture.calendar.HolidayCalendarConfig.Holiday;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/** Tokyo exchange calendar for 2023 shared by the unit tests. */
public final class TestCalendars {

    private TestCalendars() {}

    public static HolidayCalendarConfig tse2023Config() {
        HolidayCalendarConfig config = new HolidayCalendarConfig();
        config.setExchange("TSE");
        config.setHolidays(new ArrayList<>(List.of(
                new Holiday(LocalDate.of(2023, 1, 2), "New Year's Day (observed)"),
                new Holiday(LocalDate.of(2023, 1, 9), "Coming of Age Day"),
                new Holiday(LocalDate.of(2023, 2, 23), "Emperor's Birthday"),
                new Holiday(LocalDate.of(2023, 3, 21), "Vernal Equinox Day"),
                new Holiday(LocalDate.of(2023, 5, 3), "Constitution Memorial Day"),
                new Holiday(LocalDate.of(2023, 5, 4), "Greenery Day"),
                new Holiday(LocalDate.of(2023, 5, 5), "Children's Day"),
                new Holiday(LocalDate.of(2023, 7, 17), "Marine Day"),
                new Holiday(LocalDate.of(2023, 8, 11), "Mountain Day"),
                new Holiday(LocalDate.of(2023, 9, 18), "Respect for the Aged Day"),
                new Holiday(LocalDate.of(2023, 10, 9), "Sports Day"),
                new Holiday(LocalDate.of(2023, 11, 3), "Culture Day"),
                new Holiday(LocalDate.of(2023, 11, 23), "Labor Thanksgiving Day"))));
        return config;
    }

    public static BusinessDayCalendar tse2023() {
        return new BusinessDayCalendar(tse2023Config());
    }

    public static DividendDateCalculator dividendDates(BusinessDayCalendar calendar) {
        return new DividendDateCalculator(calendar);
    }
}
