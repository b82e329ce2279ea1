package com.dividendcapture.pnl;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.config.DividendPaymentConfig;
import com.dividendcapture.domain.model.Position;
import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;

/**
 * Decides on which business day a position's dividend is credited to cash.
 *
 * <ul>
 *   <li>{@code EX_DATE}: on the ex-dividend date itself.</li>
 *   <li>{@code RECORD_DATE_OFFSET}: the configured number of business days after the record date.</li>
 *   <li>{@code FISCAL_MONTH}: record month March/April pays June 30, September/October pays
 *       December 31, any other month pays the configured calendar days after the record date.
 *       Non-business days roll forward.</li>
 * </ul>
 */
public class DividendPaymentScheduler {

    private final DividendPaymentConfig config;
    private final BusinessDayCalendar calendar;

    public DividendPaymentScheduler(DividendPaymentConfig config, BusinessDayCalendar calendar) {
        this.config = config;
        this.calendar = calendar;
    }

    /**
     * @return the payment date, or null when the position carries no dividend
     */
    public LocalDate paymentDate(Position position) {
        if (!position.hasDividendInfo()) {
            return null;
        }
        return paymentDate(position.getExDividendDate(), position.getRecordDate());
    }

    public LocalDate paymentDate(LocalDate exDividendDate, LocalDate recordDate) {
        switch (config.getPolicy()) {
            case EX_DATE:
                return exDividendDate;
            case RECORD_DATE_OFFSET:
                return calendar.addBusinessDays(recordDate, config.getPaymentOffsetDays());
            case FISCAL_MONTH:
                return calendar.onOrAfter(fiscalMonthPaymentDate(recordDate));
            default:
                throw new IllegalStateException("Unhandled payment policy: " + config.getPolicy());
        }
    }

    /**
     * True when the position's dividend is due on {@code date} and has not been credited yet.
     * A position sold after its ex-dividend date keeps the entitlement until the payment date.
     */
    public boolean isPaymentDue(Position position, LocalDate date) {
        return position.hasPendingDividend() && date.equals(paymentDate(position));
    }

    private LocalDate fiscalMonthPaymentDate(LocalDate recordDate) {
        Month month = recordDate.getMonth();
        if (month == Month.MARCH || month == Month.APRIL) {
            return YearMonth.of(recordDate.getYear(), Month.JUNE).atEndOfMonth();
        }
        if (month == Month.SEPTEMBER || month == Month.OCTOBER) {
            return YearMonth.of(recordDate.getYear(), Month.DECEMBER).atEndOfMonth();
        }
        return recordDate.plusDays(config.getFallbackPaymentDays());
    }
}
