package com.dividendcapture.calendar;

import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Derives the dividend calendar dates from one another under the T+2 settlement rule:
 * the record date is two business days after the ex-dividend date.
 */
@Component
public class DividendDateCalculator {

    static final int SETTLEMENT_DAYS = 2;

    private final BusinessDayCalendar businessDayCalendar;

    public DividendDateCalculator(BusinessDayCalendar businessDayCalendar) {
        this.businessDayCalendar = businessDayCalendar;
    }

    public LocalDate recordDateFromExDate(LocalDate exDividendDate) {
        return businessDayCalendar.addBusinessDays(exDividendDate, SETTLEMENT_DAYS);
    }

    public LocalDate exDateFromRecordDate(LocalDate recordDate) {
        return businessDayCalendar.addBusinessDays(recordDate, -SETTLEMENT_DAYS);
    }

    /** The day a position must be opened to be on the register {@code daysBefore} business days early. */
    public LocalDate entryDateFromRecordDate(LocalDate recordDate, int daysBefore) {
        return businessDayCalendar.addBusinessDays(recordDate, -daysBefore);
    }
}
