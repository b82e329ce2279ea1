package com.dividendcapture.domain.model;

import com.dividendcapture.domain.enums.DecisionOutcome;
import com.dividendcapture.domain.enums.DecisionSeverity;
import com.dividendcapture.domain.enums.DecisionSource;
import com.dividendcapture.domain.enums.DecisionType;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.LocalDate;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Builder;
import lombok.Value;

/**
 * One structured entry of a run's decision journal.
 *
 * <p>{@code date} is the simulation date the decision was taken on, not wall-clock time, so
 * two runs over the same data produce identical journals.
 */
@Value
@Builder
@JsonPropertyOrder({"sequence", "date", "source", "decisionType", "outcome", "severity", "instrument", "reasoning", "context"})
public class JournalEntry {

    /** Position of the entry within its run, starting at 1. */
    long sequence;

    LocalDate date;
    DecisionSource source;
    DecisionType decisionType;
    DecisionOutcome outcome;
    DecisionSeverity severity;

    /** Instrument the decision concerns; null for run-level entries. */
    String instrument;

    String reasoning;

    @JsonIgnore
    @Builder.Default
    Map<String, Object> dataContext = Map.of();

    /** {@link #dataContext} flattened to {@code key=value;...} for tabular export. */
    @JsonProperty("context")
    public String getContextText() {
        return dataContext.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(";"));
    }
}
