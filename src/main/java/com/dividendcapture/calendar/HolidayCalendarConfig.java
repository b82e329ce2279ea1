package com.dividendcapture.calendar;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the exchange trading calendar, loaded from application.yml
 * via the {@code trading-calendar} prefix.
 *
 * <p>The holiday list is maintained by hand from the exchange's published calendar.
 * Year-end blackout days are recurring month-day pairs ({@code MM-dd}) on which the
 * exchange is closed every year regardless of weekday.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "TSE";
    private List<Holiday> holidays = new ArrayList<>();
    private List<String> yearEndClosures = new ArrayList<>(List.of("12-31", "01-01", "01-02", "01-03"));

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    public List<String> getYearEndClosures() {
        return yearEndClosures;
    }

    public void setYearEndClosures(List<String> yearEndClosures) {
        this.yearEndClosures = yearEndClosures;
    }

    /**
     * A single holiday entry on the trading calendar.
     */
    public static class Holiday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;
        private String name;

        public Holiday() {}

        public Holiday(LocalDate date, String name) {
            this.date = date;
            this.name = name;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }
    }
}
