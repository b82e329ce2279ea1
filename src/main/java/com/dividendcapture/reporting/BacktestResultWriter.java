package com.dividendcapture.reporting;

import com.dividendcapture.config.OutputConfig;
import com.dividendcapture.domain.model.DailySnapshot;
import com.dividendcapture.domain.model.JournalEntry;
import com.dividendcapture.domain.model.SignalRecord;
import com.dividendcapture.engine.BacktestResult;
import com.dividendcapture.exception.ResultExportException;
import com.dividendcapture.ledger.PositionSummaryRow;
import com.dividendcapture.ledger.TradeLogRow;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes a completed run's results into the configured results directory.
 *
 * <p>Files carry a common {@code yyyyMMdd_HHmmss} suffix:
 * <ul>
 *   <li>{@code metrics_<ts>.json} when the "json" format is enabled</li>
 *   <li>{@code trades_<ts>.csv} (if saveTrades), {@code portfolio_<ts>.csv} (if
 *       savePortfolioHistory), {@code positions_<ts>.csv}, {@code signals_<ts>.csv} and
 *       {@code journal_<ts>.csv} when the "csv" format is enabled</li>
 * </ul>
 * Empty tables are skipped. CSV columns follow each row type's declared property order.
 */
@Component
public class BacktestResultWriter {

    private static final Logger log = LoggerFactory.getLogger(BacktestResultWriter.class);

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper jsonMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private final CsvMapper csvMapper = CsvMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    public List<Path> write(BacktestResult result, OutputConfig output) {
        return write(result, output, LocalDateTime.now().format(TIMESTAMP_FORMAT));
    }

    /**
     * @param timestamp suffix shared by all files of this run
     * @return the files written, in writing order
     * @throws ResultExportException if the directory or a file cannot be written
     */
    public List<Path> write(BacktestResult result, OutputConfig output, String timestamp) {
        Path directory = Path.of(output.getResultsDir());
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ResultExportException("Cannot create results directory " + directory, e);
        }

        if (output.writesJson()) {
            Path metricsFile = directory.resolve("metrics_" + timestamp + ".json");
            try {
                jsonMapper.writeValue(metricsFile.toFile(), result.getMetrics().toMap());
            } catch (IOException e) {
                throw new ResultExportException("Failed to write " + metricsFile, e);
            }
            written.add(metricsFile);
            log.info("Metrics saved to {}", metricsFile);
        }

        if (output.writesCsv()) {
            if (output.isSaveTrades()) {
                writeCsv(directory.resolve("trades_" + timestamp + ".csv"), TradeLogRow.class, result.getTrades(), written);
            }
            writeCsv(directory.resolve("positions_" + timestamp + ".csv"), PositionSummaryRow.class,
                    result.getPositions(), written);
            if (output.isSavePortfolioHistory()) {
                writeCsv(directory.resolve("portfolio_" + timestamp + ".csv"), DailySnapshot.class,
                        result.getDailySnapshots(), written);
            }
            writeCsv(directory.resolve("signals_" + timestamp + ".csv"), SignalRecord.class, result.getSignals(), written);
            writeCsv(directory.resolve("journal_" + timestamp + ".csv"), JournalEntry.class, result.getJournal(), written);
        }
        return written;
    }

    private <T> void writeCsv(Path file, Class<T> rowType, List<T> rows, List<Path> written) {
        if (rows == null || rows.isEmpty()) {
            log.debug("Nothing to write for {}", file);
            return;
        }
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        try {
            csvMapper.writer(schema).writeValue(file.toFile(), rows);
        } catch (IOException e) {
            throw new ResultExportException("Failed to write " + file, e);
        }
        written.add(file);
        log.info("{} rows saved to {}", rows.size(), file);
    }
}
