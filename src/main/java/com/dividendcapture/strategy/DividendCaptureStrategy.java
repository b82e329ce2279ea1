package com.dividendcapture.strategy;

import com.dividendcapture.calendar.BusinessDayCalendar;
import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.config.StrategyConfig;
import com.dividendcapture.domain.enums.ExitReason;
import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.PortfolioContext;
import com.dividendcapture.domain.model.PositionContext;
import com.dividendcapture.domain.model.Signal;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry, addition and exit decisions of the dividend-capture strategy.
 *
 * <p>The strategy holds no mutable state: every method receives the full context it needs
 * and returns a {@link Signal} or null, so each decision can be reproduced from its inputs.
 * The engine calls it once per instrument per business day.
 *
 * <ul>
 *   <li><b>Entry:</b> on the business day {@code daysBeforeRecord} before the record date,
 *       buy {@code positionSize} worth of shares, rounded down to whole lots</li>
 *   <li><b>Addition:</b> on the ex-dividend date, optionally only when the price dropped below
 *       the pre-ex close, buy {@code additionRatio} of the initial position value again</li>
 *   <li><b>Exit:</b> stop loss, then max holding period, then window fill; the whole position
 *       is sold</li>
 * </ul>
 */
public class DividendCaptureStrategy {

    private static final Logger log = LoggerFactory.getLogger(DividendCaptureStrategy.class);

    private final StrategyConfig config;
    private final BusinessDayCalendar calendar;
    private final DividendDateCalculator dividendDateCalculator;

    public DividendCaptureStrategy(
            StrategyConfig config, BusinessDayCalendar calendar, DividendDateCalculator dividendDateCalculator) {
        this.config = config;
        this.calendar = calendar;
        this.dividendDateCalculator = dividendDateCalculator;
    }

    /**
     * @return an ENTRY signal when {@code currentDate} is the entry date for the dividend, else null
     */
    public Signal checkEntrySignal(
            String instrument, LocalDate currentDate, DividendInfo dividendInfo, BigDecimal currentPrice) {
        if (dividendInfo == null || currentPrice == null || currentPrice.signum() <= 0) {
            return null;
        }
        if (!dividendInfo.isComplete()) {
            log.debug("Entry skipped for {}: incomplete dividend {}", instrument, dividendInfo);
            return null;
        }

        LocalDate entryDate = dividendDateCalculator.entryDateFromRecordDate(
                dividendInfo.getRecordDate(), config.getDaysBeforeRecord());
        if (!currentDate.equals(entryDate)) {
            return null;
        }

        int shares = calculatePositionSize(currentPrice, config.getPositionSize());
        if (shares <= 0) {
            log.debug("Entry skipped for {}: position size {} buys no full lot at {}",
                    instrument, config.getPositionSize(), currentPrice);
            return null;
        }

        return Signal.builder()
                .instrument(instrument)
                .kind(SignalKind.ENTRY)
                .date(currentDate)
                .price(currentPrice)
                .shares(shares)
                .reason("Entry " + config.getDaysBeforeRecord() + " business days before record date "
                        + dividendInfo.getRecordDate())
                .metadata(Map.of(
                        "recordDate", dividendInfo.getRecordDate(),
                        "exDividendDate", dividendInfo.getExDividendDate(),
                        "dividendPerShare", dividendInfo.getDividendPerShare()))
                .build();
    }

    /**
     * Evaluated by the engine on the position's ex-dividend date only.
     *
     * @param preExPrice close on the business day before the ex-dividend date
     * @return an ADD signal, or null
     */
    public Signal checkAdditionSignal(
            String instrument,
            LocalDate currentDate,
            PositionContext position,
            BigDecimal currentPrice,
            BigDecimal preExPrice) {
        if (!config.isAdditionEnabled() || currentPrice == null || currentPrice.signum() <= 0) {
            return null;
        }
        if (config.isAdditionOnDropOnly() && (preExPrice == null || currentPrice.compareTo(preExPrice) >= 0)) {
            return null;
        }

        BigDecimal additionBudget = position.getInitialValue().multiply(config.getAdditionRatio());
        int shares = calculatePositionSize(currentPrice, additionBudget);
        if (shares <= 0) {
            return null;
        }

        return Signal.builder()
                .instrument(instrument)
                .kind(SignalKind.ADD)
                .date(currentDate)
                .price(currentPrice)
                .shares(shares)
                .reason("Add on ex-dividend date: price " + currentPrice + " vs pre-ex " + preExPrice)
                .metadata(Map.of("preExPrice", preExPrice != null ? preExPrice : BigDecimal.ZERO))
                .build();
    }

    /**
     * Returns the first matching exit in priority order: stop loss, max holding period,
     * window fill. Window fill needs a recorded pre-ex price.
     */
    public Signal checkExitSignal(
            String instrument, LocalDate currentDate, PositionContext position, BigDecimal currentPrice) {
        if (currentPrice == null || position.getTotalShares() <= 0) {
            return null;
        }

        ExitReason reason = null;
        String detail = null;

        BigDecimal stopPrice = position.getAveragePrice().multiply(BigDecimal.ONE.subtract(config.getStopLossPct()));
        int heldDays = calendar.businessDaysBetween(position.getEntryDate(), currentDate);

        if (currentPrice.compareTo(stopPrice) <= 0) {
            reason = ExitReason.STOP_LOSS;
            detail = "Stop loss: price " + currentPrice + " <= " + stopPrice.setScale(2, RoundingMode.HALF_UP);
        } else if (heldDays >= config.getMaxHoldingDays()) {
            reason = ExitReason.MAX_HOLDING_PERIOD;
            detail = "Max holding period: " + heldDays + " business days";
        } else if (config.isExitOnWindowFill()
                && position.getPreExPrice() != null
                && currentPrice.compareTo(position.getPreExPrice()) >= 0) {
            reason = ExitReason.WINDOW_FILLED;
            detail = "Window filled: price " + currentPrice + " >= pre-ex " + position.getPreExPrice();
        }

        if (reason == null) {
            return null;
        }

        return Signal.builder()
                .instrument(instrument)
                .kind(SignalKind.EXIT)
                .date(currentDate)
                .price(currentPrice)
                .shares(position.getTotalShares())
                .reason(detail)
                .exitReason(reason)
                .metadata(Map.of("exitReason", reason.getKey(), "holdingDays", heldDays))
                .build();
    }

    /**
     * Pre-trade check on ENTRY signals against the position cap and available cash. The exact
     * cash check, commission included, happens at execution. Other kinds always pass.
     */
    public boolean validateSignal(Signal signal, PortfolioContext portfolio) {
        if (signal.getKind() != SignalKind.ENTRY) {
            return true;
        }
        if (portfolio.getOpenPositionCount() >= config.getMaxPositions()) {
            log.debug("Entry rejected for {}: {} open positions (max {})",
                    signal.getInstrument(), portfolio.getOpenPositionCount(), config.getMaxPositions());
            return false;
        }
        BigDecimal required = signal.getPrice().multiply(BigDecimal.valueOf(signal.getShares()));
        if (portfolio.getCash().compareTo(required) < 0) {
            log.debug("Entry rejected for {}: cash {} < required {}",
                    signal.getInstrument(), portfolio.getCash(), required);
            return false;
        }
        return true;
    }

    /**
     * Whole lots affordable with {@code budget} at {@code price}: floor(budget / price / lot) x lot.
     */
    public int calculatePositionSize(BigDecimal price, BigDecimal budget) {
        if (price == null || price.signum() <= 0 || budget == null || budget.signum() <= 0) {
            return 0;
        }
        int lotSize = config.getLotSize();
        BigDecimal lots = budget.divide(price.multiply(BigDecimal.valueOf(lotSize)), 0, RoundingMode.FLOOR);
        return lots.intValue() * lotSize;
    }
}
