package com.dividendcapture.runner;

import com.dividendcapture.calendar.DividendDateCalculator;
import com.dividendcapture.config.BacktestConfig;
import com.dividendcapture.config.BacktestProperties;
import com.dividendcapture.engine.BacktestResult;
import com.dividendcapture.engine.BacktestService;
import com.dividendcapture.exception.BaseException;
import com.dividendcapture.exception.DataValidationException;
import com.dividendcapture.marketdata.CsvMarketDataLoader;
import com.dividendcapture.reporting.BacktestResultWriter;
import com.dividendcapture.reporting.SummaryReportFormatter;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Command-line run: loads CSV market data from the configured directory, runs one backtest,
 * logs the summary and writes the result files.
 *
 * <p>Active only with {@code dividend-capture.runner.enabled=true}. Fatal errors are logged
 * and turned into the process exit code of their {@link com.dividendcapture.exception.ErrorCode};
 * an aborted run writes no output.
 */
@Component
@ConditionalOnProperty(prefix = "dividend-capture.runner", name = "enabled", havingValue = "true")
public class BacktestRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(BacktestRunner.class);

    private final BacktestProperties backtestProperties;
    private final BacktestService backtestService;
    private final DividendDateCalculator dividendDateCalculator;
    private final BacktestResultWriter backtestResultWriter;
    private final SummaryReportFormatter summaryReportFormatter;

    private int exitCode;

    public BacktestRunner(
            BacktestProperties backtestProperties,
            BacktestService backtestService,
            DividendDateCalculator dividendDateCalculator,
            BacktestResultWriter backtestResultWriter,
            SummaryReportFormatter summaryReportFormatter) {
        this.backtestProperties = backtestProperties;
        this.backtestService = backtestService;
        this.dividendDateCalculator = dividendDateCalculator;
        this.backtestResultWriter = backtestResultWriter;
        this.summaryReportFormatter = summaryReportFormatter;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            BacktestConfig config = backtestProperties.toConfig();
            Path dataDirectory = Paths.get(config.getDataDirectory());
            BacktestResult result = backtestService.run(config, new CsvMarketDataLoader(dataDirectory, dividendDateCalculator));

            log.info("\n{}", summaryReportFormatter.format(result));
            backtestResultWriter.write(result, config.getOutput())
                    .forEach(path -> log.info("Wrote {}", path));
            exitCode = 0;
        } catch (DataValidationException e) {
            e.getReport().getErrors().forEach(error -> log.error("Data validation error: {}", error));
            log.error("Backtest aborted: {}", e.getMessage());
            exitCode = e.getErrorCode().getExitCode();
        } catch (BaseException e) {
            log.error("Backtest aborted [{}]: {}", e.getErrorCode().getCode(), e.getMessage(), e);
            exitCode = e.getErrorCode().getExitCode();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
