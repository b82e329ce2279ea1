package com.dividendcapture.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Business-day arithmetic over the exchange calendar.
 *
 * <p>A day is a business day unless it falls on a weekend, on a configured exchange
 * holiday, or on one of the fixed year-end closure days. All methods are pure functions
 * of the configured calendar; nothing here depends on the wall clock.
 *
 * <p>Holiday data is loaded from YAML configuration via {@link HolidayCalendarConfig} and
 * snapshotted at construction, so one calendar instance answers identically for the
 * whole backtest run.
 */
@Service
public class BusinessDayCalendar {

    private static final Logger log = LoggerFactory.getLogger(BusinessDayCalendar.class);

    private final Set<LocalDate> holidays;
    private final Set<MonthDay> yearEndClosures;

    public BusinessDayCalendar(HolidayCalendarConfig holidayCalendarConfig) {
        this.holidays = holidayCalendarConfig.getHolidays().stream()
                .map(HolidayCalendarConfig.Holiday::getDate)
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
        this.yearEndClosures = holidayCalendarConfig.getYearEndClosures().stream()
                .map(value -> MonthDay.parse("--" + value.trim()))
                .collect(Collectors.toUnmodifiableSet());
        log.info(
                "Business-day calendar for {}: {} holidays, {} year-end closure days",
                holidayCalendarConfig.getExchange(),
                holidays.size(),
                yearEndClosures.size());
    }

    /**
     * Returns false for weekends, exchange holidays and year-end closure days.
     */
    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        if (holidays.contains(date)) {
            return false;
        }
        return !yearEndClosures.contains(MonthDay.from(date));
    }

    /**
     * Walks day by day in the direction of {@code days}, counting only business days,
     * until |days| business days have been crossed. Zero returns the date unchanged,
     * even when it is not itself a business day.
     */
    public LocalDate addBusinessDays(LocalDate date, int days) {
        LocalDate current = date;
        int remaining = Math.abs(days);
        int step = days >= 0 ? 1 : -1;
        while (remaining > 0) {
            current = current.plusDays(step);
            if (isBusinessDay(current)) {
                remaining--;
            }
        }
        return current;
    }

    /**
     * Counts the business days crossed when walking from {@code from} to {@code to}:
     * the start date is excluded and the end date included. The result is negative
     * when {@code from} is after {@code to}, and zero when the dates are equal.
     */
    public int businessDaysBetween(LocalDate from, LocalDate to) {
        LocalDate start = from;
        LocalDate end = to;
        int sign = 1;
        if (start.isAfter(end)) {
            start = to;
            end = from;
            sign = -1;
        }

        int count = 0;
        LocalDate current = start;
        while (current.isBefore(end)) {
            current = current.plusDays(1);
            if (isBusinessDay(current)) {
                count++;
            }
        }
        return count * sign;
    }

    /** Returns every business day in the closed interval [start, end], in ascending order. */
    public List<LocalDate> businessDaysInRange(LocalDate start, LocalDate end) {
        List<LocalDate> days = new ArrayList<>();
        LocalDate current = start;
        while (!current.isAfter(end)) {
            if (isBusinessDay(current)) {
                days.add(current);
            }
            current = current.plusDays(1);
        }
        return days;
    }

    /** Returns the next business day strictly after the given date. */
    public LocalDate nextBusinessDay(LocalDate from) {
        return addBusinessDays(from, 1);
    }

    /** Returns the previous business day strictly before the given date. */
    public LocalDate previousBusinessDay(LocalDate from) {
        return addBusinessDays(from, -1);
    }

    /** Returns the date itself when it is a business day, otherwise the next business day. */
    public LocalDate onOrAfter(LocalDate date) {
        return isBusinessDay(date) ? date : nextBusinessDay(date);
    }
}
