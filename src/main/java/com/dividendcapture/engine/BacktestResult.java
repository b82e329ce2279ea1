package com.dividendcapture.engine;

import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.domain.model.DailySnapshot;
import com.dividendcapture.domain.model.JournalEntry;
import com.dividendcapture.domain.model.SignalRecord;
import com.dividendcapture.ledger.HoldingView;
import com.dividendcapture.ledger.PositionSummaryRow;
import com.dividendcapture.ledger.TradeLogRow;
import com.dividendcapture.marketdata.DataValidationReport;
import com.dividendcapture.portfolio.PerformanceMetrics;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a completed run produced: metrics, trade log, positions summary, daily
 * snapshots, signal history and the decision journal.
 */
@Value
@Builder
public class BacktestResult {

    BacktestConfig config;
    PerformanceMetrics metrics;
    List<TradeLogRow> trades;
    List<PositionSummaryRow> positions;
    List<DailySnapshot> dailySnapshots;
    List<SignalRecord> signals;
    List<JournalEntry> journal;

    /** Positions still open at the end of the window. */
    List<HoldingView> holdings;

    /** Non-fatal data warnings collected before the run. */
    DataValidationReport dataValidation;

    BigDecimal finalCash;
    int tradingDays;
}
