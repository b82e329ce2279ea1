package com.dividendcapture.reporting;

import com.dividendcapture.engine.BacktestResult;
import com.dividendcapture.portfolio.PerformanceMetrics;
import java.math.BigDecimal;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Renders the plain-text summary printed at the end of a run. */
@Component
public class SummaryReportFormatter {

    private static final String RULE = "=".repeat(60);

    public String format(BacktestResult result) {
        PerformanceMetrics m = result.getMetrics();
        StringBuilder report = new StringBuilder();
        report.append(RULE).append('\n');
        report.append("BACKTEST SUMMARY REPORT").append('\n');
        report.append(RULE).append('\n');
        report.append(String.format(Locale.ROOT, "Period: %s to %s (%d trading days)%n",
                result.getConfig().getStartDate(), result.getConfig().getEndDate(), result.getTradingDays()));

        report.append("\n[Returns]\n");
        report.append(line("Total Return", percent(m.getTotalReturn())));
        report.append(line("Annualized Return", percent(m.getAnnualizedReturn())));

        report.append("\n[Risk]\n");
        report.append(line("Annual Volatility", percent(m.getAnnualizedVolatility())));
        report.append(line("Max Drawdown", percent(m.getMaxDrawdown())));

        report.append("\n[Risk-Adjusted Returns]\n");
        report.append(line("Sharpe Ratio", ratio(m.getSharpeRatio())));
        report.append(line("Sortino Ratio", ratio(m.getSortinoRatio())));
        report.append(line("Calmar Ratio", ratio(m.getCalmarRatio())));

        report.append("\n[Trading Statistics]\n");
        report.append(line("Total Trades", String.valueOf(m.getTotalTrades())));
        report.append(line("Closed Positions", String.valueOf(m.getClosedPositions())));
        report.append(line("Win Rate", percent(m.getWinRate())));
        report.append(line("Profit Factor", ratio(m.getProfitFactor())));
        report.append(line("Average Holding Days", String.format(Locale.ROOT, "%.1f", m.getAvgHoldingDays())));

        report.append("\n[Dividends]\n");
        report.append(line("Total Dividend", money(m.getTotalDividend())));
        report.append(line("Positions With Dividend", String.valueOf(m.getPositionsWithDividend())));

        report.append("\n[Final Results]\n");
        report.append(line("Final Portfolio Value", money(m.getFinalValue())));
        report.append(line("Total Commission Paid", money(m.getTotalCommission())));
        report.append(line("Open Positions", String.valueOf(result.getHoldings().size())));
        report.append('\n').append(RULE);
        return report.toString();
    }

    private static String line(String label, String value) {
        return label + ": " + value + "\n";
    }

    private static String percent(double value) {
        return String.format(Locale.ROOT, "%.2f%%", value * 100);
    }

    private static String ratio(double value) {
        if (Double.isInfinite(value)) {
            return "inf";
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static String money(BigDecimal value) {
        return String.format(Locale.ROOT, "%,.0f", value);
    }
}
