package com.dividendcapture.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.dividendcapture.domain.enums.DecisionOutcome;
import com.dividendcapture.domain.enums.DecisionSeverity;
import com.dividendcapture.domain.enums.DecisionSource;
import com.dividendcapture.domain.enums.DecisionType;
import com.dividendcapture.domain.enums.RejectionReason;
import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.model.ExecutionResult;
import com.dividendcapture.domain.model.JournalEntry;
import com.dividendcapture.domain.model.Signal;
import com.dividendcapture.marketdata.DataValidationReport;
import com.dividendcapture.observability.BacktestJournal;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BacktestJournalTest {

    private static final LocalDate DAY = LocalDate.of(2023, 3, 28);

    private BacktestJournal journal;

    @BeforeEach
    void setUp() {
        journal = new BacktestJournal();
    }

    @Test
    @DisplayName("Entries are numbered in recording order")
    void sequence() {
        journal.logRunStarted(DAY, DAY.plusDays(10), new BigDecimal("10000000"), 2);
        journal.logProgress(DAY, 0, 10);
        journal.logPriceMissing(DAY, "7203");

        assertThat(journal.getEntries()).extracting(JournalEntry::getSequence).containsExactly(1L, 2L, 3L);
        assertThat(journal.size()).isEqualTo(3);
        assertThat(journal.getEntries().get(1).getReasoning()).isEqualTo("Progress: 0.0% (2023-03-28)");
    }

    @Test
    @DisplayName("Accepted and rejected signals carry outcome and rejection context")
    void signals() {
        Signal signal = Signal.builder()
                .instrument("7203")
                .kind(SignalKind.ENTRY)
                .date(DAY)
                .price(new BigDecimal("2000"))
                .shares(500)
                .reason("entry")
                .build();

        journal.logSignal(signal, true, null);
        journal.logSignal(signal, false, RejectionReason.SIGNAL_REJECTED);

        List<JournalEntry> entries = journal.getEntries(DecisionType.ENTRY_SIGNAL);
        assertThat(entries).extracting(JournalEntry::getOutcome)
                .containsExactly(DecisionOutcome.TRIGGERED, DecisionOutcome.REJECTED);
        assertThat(entries.get(1).getDataContext()).containsEntry("rejection", RejectionReason.SIGNAL_REJECTED);
        assertThat(entries.get(0).getSource()).isEqualTo(DecisionSource.STRATEGY);
    }

    @Test
    @DisplayName("Rejected execution is a warning with the rejection reason")
    void rejectedExecution() {
        journal.logExecution(DAY, "7203", SignalKind.ADD,
                ExecutionResult.rejected(RejectionReason.NO_POSITION, "No open position"));

        JournalEntry entry = journal.getEntries().get(0);
        assertThat(entry.getDecisionType()).isEqualTo(DecisionType.POSITION_ADDED);
        assertThat(entry.getSeverity()).isEqualTo(DecisionSeverity.WARNING);
        assertThat(entry.getReasoning()).isEqualTo("No open position");
    }

    @Test
    @DisplayName("Each data warning becomes an entry")
    void dataWarnings() {
        journal.logDataValidation(DAY, new DataValidationReport(List.of(), List.of("a", "b")));

        assertThat(journal.getEntries(DecisionType.DATA_VALIDATED)).hasSize(2);
    }

    @Test
    @DisplayName("Context keeps insertion order and is detached from the caller's map")
    void contextCopied() {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("b", 1);
        context.put("a", 2);

        JournalEntry entry = journal.record(DAY, DecisionSource.ENGINE, DecisionType.RUN_PROGRESS,
                DecisionOutcome.INFO, DecisionSeverity.INFO, null, "x", context);
        context.put("c", 3);

        assertThat(entry.getDataContext()).containsOnlyKeys("b", "a");
        assertThat(entry.getDataContext().keySet()).containsExactly("b", "a");
    }
}
