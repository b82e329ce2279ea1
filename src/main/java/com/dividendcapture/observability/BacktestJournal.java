package com.dividendcapture.observability;

import com.dividendcapture.domain.enums.DecisionOutcome;
import com.dividendcapture.domain.enums.DecisionSeverity;
import com.dividendcapture.domain.enums.DecisionSource;
import com.dividendcapture.domain.enums.DecisionType;
import com.dividendcapture.domain.enums.RejectionReason;
import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.model.ExecutionResult;
import com.dividendcapture.domain.model.JournalEntry;
import com.dividendcapture.domain.model.Signal;
import com.dividendcapture.domain.model.Trade;
import com.dividendcapture.marketdata.DataValidationReport;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decision journal scoped to a single backtest run.
 *
 * <p>The engine creates one journal per run and hands it to the portfolio, so entries from
 * different runs never mix. Every strategy signal, portfolio execution, dividend credit and
 * run milestone is captured as a {@link JournalEntry} and mirrored to SLF4J at the entry's
 * severity. The journal is exported alongside the other results.
 *
 * <p>Specialized methods set source, type, outcome and severity for each kind of event;
 * they all delegate to {@link #record}.
 */
public class BacktestJournal {

    private static final Logger logger = LoggerFactory.getLogger(BacktestJournal.class);

    private final List<JournalEntry> entries = new ArrayList<>();

    /**
     * Appends an entry and mirrors it to the application log.
     */
    public JournalEntry record(
            LocalDate date,
            DecisionSource source,
            DecisionType decisionType,
            DecisionOutcome outcome,
            DecisionSeverity severity,
            String instrument,
            String reasoning,
            Map<String, Object> dataContext) {

        JournalEntry entry = JournalEntry.builder()
                .sequence(entries.size() + 1L)
                .date(date)
                .source(source)
                .decisionType(decisionType)
                .outcome(outcome)
                .severity(severity)
                .instrument(instrument)
                .reasoning(reasoning)
                .dataContext(dataContext != null ? Collections.unmodifiableMap(new LinkedHashMap<>(dataContext)) : Map.of())
                .build();
        entries.add(entry);
        mirror(entry);
        return entry;
    }

    // ---- Run lifecycle ----

    public void logRunStarted(LocalDate startDate, LocalDate endDate, BigDecimal initialCapital, int instruments) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("endDate", endDate);
        context.put("initialCapital", initialCapital);
        context.put("instruments", instruments);
        record(startDate, DecisionSource.ENGINE, DecisionType.RUN_STARTED, DecisionOutcome.INFO,
                DecisionSeverity.INFO, null, "Backtest started", context);
    }

    public void logProgress(LocalDate date, int dayIndex, int totalDays) {
        double pct = totalDays == 0 ? 100.0 : dayIndex * 100.0 / totalDays;
        record(date, DecisionSource.ENGINE, DecisionType.RUN_PROGRESS, DecisionOutcome.INFO,
                DecisionSeverity.INFO, null, String.format("Progress: %.1f%% (%s)", pct, date), Map.of());
    }

    public void logRunCompleted(LocalDate date, BigDecimal finalValue, int totalTrades) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("finalValue", finalValue);
        context.put("totalTrades", totalTrades);
        record(date, DecisionSource.ENGINE, DecisionType.RUN_COMPLETED, DecisionOutcome.INFO,
                DecisionSeverity.INFO, null, "Backtest completed", context);
    }

    public void logDataValidation(LocalDate date, DataValidationReport report) {
        for (String warning : report.getWarnings()) {
            record(date, DecisionSource.MARKET_DATA, DecisionType.DATA_VALIDATED, DecisionOutcome.INFO,
                    DecisionSeverity.WARNING, null, warning, Map.of());
        }
    }

    public void logPriceMissing(LocalDate date, String instrument) {
        record(date, DecisionSource.MARKET_DATA, DecisionType.PRICE_MISSING, DecisionOutcome.SKIPPED,
                DecisionSeverity.DEBUG, instrument, "No price available; instrument skipped for the day", Map.of());
    }

    // ---- Strategy ----

    /**
     * Records a signal emitted by the strategy and whether pre-trade validation accepted it.
     */
    public void logSignal(Signal signal, boolean accepted, RejectionReason rejectionReason) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("price", signal.getPrice());
        context.put("shares", signal.getShares());
        if (rejectionReason != null) {
            context.put("rejection", rejectionReason);
        }
        record(signal.getDate(), DecisionSource.STRATEGY, signalType(signal.getKind()),
                accepted ? DecisionOutcome.TRIGGERED : DecisionOutcome.REJECTED,
                accepted ? DecisionSeverity.INFO : DecisionSeverity.DEBUG,
                signal.getInstrument(), signal.getReason(), context);
    }

    // ---- Portfolio ----

    /**
     * Records the outcome of a buy or sell execution.
     */
    public void logExecution(LocalDate date, String instrument, SignalKind kind, ExecutionResult result) {
        DecisionType type = executionType(kind);
        if (result.isSuccess()) {
            Trade trade = result.getTrade();
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("price", trade.getPrice());
            context.put("shares", trade.getShares());
            context.put("commission", trade.getCommission());
            if (kind == SignalKind.EXIT) {
                context.put("realizedPnL", result.getPosition().getRealizedPnL());
            }
            record(date, DecisionSource.PORTFOLIO, type, DecisionOutcome.TRIGGERED, DecisionSeverity.INFO,
                    instrument, trade.getReason(), context);
        } else {
            record(date, DecisionSource.PORTFOLIO, type, DecisionOutcome.REJECTED, DecisionSeverity.WARNING,
                    instrument, result.getMessage(), Map.of("rejection", result.getRejectionReason()));
        }
    }

    public void logDividend(LocalDate date, String instrument, ExecutionResult result) {
        if (result.isSuccess()) {
            record(date, DecisionSource.PORTFOLIO, DecisionType.DIVIDEND_CREDITED, DecisionOutcome.TRIGGERED,
                    DecisionSeverity.INFO, instrument, "Dividend credited",
                    Map.of("amount", result.getCashCredited()));
        } else {
            record(date, DecisionSource.PORTFOLIO, DecisionType.DIVIDEND_CREDITED, DecisionOutcome.REJECTED,
                    DecisionSeverity.WARNING, instrument, result.getMessage(),
                    Map.of("rejection", result.getRejectionReason()));
        }
    }

    public void logPreExPrice(LocalDate date, String instrument, BigDecimal preExPrice) {
        record(date, DecisionSource.ENGINE, DecisionType.PRE_EX_PRICE_RECORDED, DecisionOutcome.INFO,
                DecisionSeverity.DEBUG, instrument, "Pre-ex-dividend close recorded", Map.of("preExPrice", preExPrice));
    }

    // ---- Queries ----

    public List<JournalEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<JournalEntry> getEntries(DecisionType type) {
        return entries.stream().filter(e -> e.getDecisionType() == type).toList();
    }

    public int size() {
        return entries.size();
    }

    private static DecisionType signalType(SignalKind kind) {
        switch (kind) {
            case ENTRY:
                return DecisionType.ENTRY_SIGNAL;
            case ADD:
                return DecisionType.ADD_SIGNAL;
            default:
                return DecisionType.EXIT_SIGNAL;
        }
    }

    private static DecisionType executionType(SignalKind kind) {
        if (kind == null) {
            return DecisionType.POSITION_OPENED;
        }
        switch (kind) {
            case ENTRY:
                return DecisionType.POSITION_OPENED;
            case ADD:
                return DecisionType.POSITION_ADDED;
            default:
                return DecisionType.POSITION_CLOSED;
        }
    }

    private static void mirror(JournalEntry entry) {
        switch (entry.getSeverity()) {
            case WARNING:
                logger.warn("[{}] {} {} {}: {}", entry.getDate(), entry.getDecisionType(), entry.getOutcome(),
                        entry.getInstrument() != null ? entry.getInstrument() : "-", entry.getReasoning());
                break;
            case INFO:
                logger.info("[{}] {} {} {}: {}", entry.getDate(), entry.getDecisionType(), entry.getOutcome(),
                        entry.getInstrument() != null ? entry.getInstrument() : "-", entry.getReasoning());
                break;
            default:
                logger.debug("[{}] {} {} {}: {}", entry.getDate(), entry.getDecisionType(), entry.getOutcome(),
                        entry.getInstrument() != null ? entry.getInstrument() : "-", entry.getReasoning());
        }
    }
}
