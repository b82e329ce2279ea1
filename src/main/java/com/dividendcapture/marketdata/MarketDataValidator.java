package com.dividendcapture.marketdata;

import com.dividendcapture.domain.model.PriceBar;
import com.dividendcapture.exception.DataValidationException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Checks loaded market data before the day loop starts.
 *
 * <p>An instrument with no usable close at all is an error. Null closes, day-over-day moves
 * larger than 50% and instruments without any dividend event are warnings.
 */
@Component
public class MarketDataValidator {

    private static final Logger log = LoggerFactory.getLogger(MarketDataValidator.class);

    static final BigDecimal EXTREME_MOVE_THRESHOLD = new BigDecimal("0.5");

    public DataValidationReport validate(MarketDataProvider provider, List<String> instruments) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        for (String instrument : instruments) {
            List<PriceBar> bars = provider.priceBars(instrument);
            long usable = bars.stream().filter(PriceBar::hasClose).count();
            if (usable == 0) {
                errors.add(instrument + ": No price data");
                continue;
            }

            long nullCloses = bars.size() - usable;
            if (nullCloses > 0) {
                warnings.add(instrument + ": " + nullCloses + " null values in price data");
            }

            int extremeMoves = countExtremeMoves(bars);
            if (extremeMoves > 0) {
                warnings.add(instrument + ": " + extremeMoves + " extreme price moves (>50%)");
            }

            if (provider.dividends(instrument).isEmpty()) {
                warnings.add(instrument + ": No dividend data");
            }
        }

        DataValidationReport report = new DataValidationReport(errors, warnings);
        report.getWarnings().forEach(w -> log.warn("Data warning: {}", w));
        report.getErrors().forEach(e -> log.error("Data error: {}", e));
        return report;
    }

    /**
     * Validates and throws if any instrument is unusable.
     *
     * @throws DataValidationException carrying the full report
     */
    public DataValidationReport validateOrThrow(MarketDataProvider provider, List<String> instruments) {
        DataValidationReport report = validate(provider, instruments);
        if (report.hasErrors()) {
            throw new DataValidationException(report);
        }
        return report;
    }

    private int countExtremeMoves(List<PriceBar> bars) {
        int count = 0;
        BigDecimal previous = null;
        for (PriceBar bar : bars) {
            if (!bar.hasClose()) {
                continue;
            }
            if (previous != null && previous.signum() > 0) {
                BigDecimal change = bar.getClose().subtract(previous).divide(previous, MathContext.DECIMAL64);
                if (change.abs().compareTo(EXTREME_MOVE_THRESHOLD) > 0) {
                    count++;
                }
            }
            previous = bar.getClose();
        }
        return count;
    }
}
