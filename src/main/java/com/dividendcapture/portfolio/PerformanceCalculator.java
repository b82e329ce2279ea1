package com.dividendcapture.portfolio;

import com.dividendcapture.domain.model.DailySnapshot;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.Trade;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives {@link PerformanceMetrics} from a run's daily history, trades and closed positions.
 *
 * <p>Daily returns are taken from every snapshot after the first. Annualization assumes
 * {@value #TRADING_DAYS_PER_YEAR} trading days: annualized return compounds the mean daily
 * return, volatility scales the population standard deviation by sqrt(252). Sharpe and
 * Sortino use a fixed {@value #RISK_FREE_RATE} annual risk-free rate.
 */
public class PerformanceCalculator {

    private static final Logger log = LoggerFactory.getLogger(PerformanceCalculator.class);

    static final int TRADING_DAYS_PER_YEAR = 252;
    static final double RISK_FREE_RATE = 0.01;
    private static final int MONEY_SCALE = 2;

    public PerformanceMetrics calculate(
            BigDecimal initialCapital,
            List<DailySnapshot> history,
            List<Trade> trades,
            List<Position> closedPositions,
            List<Position> allPositions) {

        BigDecimal finalValue = history.isEmpty() ? initialCapital : history.get(history.size() - 1).getTotalValue();
        double totalReturn = finalValue.subtract(initialCapital).doubleValue() / initialCapital.doubleValue();

        double[] dailyReturns = dailyReturns(history);
        double annualizedReturn = annualizedReturn(dailyReturns);
        double annualizedVolatility = annualizedVolatility(dailyReturns);
        double downsideDeviation = downsideDeviation(dailyReturns);
        double maxDrawdown = maxDrawdown(history);

        double excessReturn = annualizedReturn - RISK_FREE_RATE;
        double sharpeRatio = annualizedVolatility > 0 ? excessReturn / annualizedVolatility : 0;
        double sortinoRatio = downsideDeviation > 0 ? excessReturn / downsideDeviation : 0;
        double calmarRatio = maxDrawdown < 0 ? annualizedReturn / Math.abs(maxDrawdown) : 0;

        List<BigDecimal> profits = closedPositions.stream()
                .map(Position::getRealizedPnL)
                .filter(pnl -> pnl.signum() > 0)
                .toList();
        List<BigDecimal> losses = closedPositions.stream()
                .map(Position::getRealizedPnL)
                .filter(pnl -> pnl.signum() < 0)
                .toList();
        int winning = profits.size();
        int losing = closedPositions.size() - winning;

        BigDecimal grossProfit = sum(profits);
        BigDecimal grossLoss = sum(losses).abs();

        int buyTrades = (int) trades.stream().filter(Trade::isBuy).count();
        BigDecimal totalCommission = sum(trades.stream().map(Trade::getCommission).toList());

        List<BigDecimal> dividends = allPositions.stream()
                .map(Position::getDividendReceivedTotal)
                .filter(d -> d.signum() > 0)
                .toList();
        BigDecimal totalDividend = sum(dividends);

        double avgHoldingDays = closedPositions.stream()
                .mapToLong(p -> p.holdingDays(p.getExitDate()))
                .average()
                .orElse(0);

        PerformanceMetrics metrics = PerformanceMetrics.builder()
                .initialCapital(initialCapital)
                .finalValue(finalValue)
                .totalReturn(totalReturn)
                .annualizedReturn(annualizedReturn)
                .annualizedVolatility(annualizedVolatility)
                .downsideDeviation(downsideDeviation)
                .maxDrawdown(maxDrawdown)
                .sharpeRatio(sharpeRatio)
                .sortinoRatio(sortinoRatio)
                .calmarRatio(calmarRatio)
                .totalTrades(trades.size())
                .buyTrades(buyTrades)
                .sellTrades(trades.size() - buyTrades)
                .closedPositions(closedPositions.size())
                .winningTrades(winning)
                .losingTrades(losing)
                .winRate(closedPositions.isEmpty() ? 0 : (double) winning / closedPositions.size())
                .profitFactor(profitFactor(closedPositions.size(), grossProfit, grossLoss))
                .avgProfit(average(profits))
                .avgLoss(average(losses))
                .avgHoldingDays(avgHoldingDays)
                .totalRealizedPnl(sum(closedPositions.stream().map(Position::getRealizedPnL).toList()))
                .totalCommission(totalCommission)
                .totalDividend(totalDividend)
                .positionsWithDividend(dividends.size())
                .avgDividendPerPosition(average(dividends))
                .build();

        log.debug("Performance calculated: totalReturn={} sharpe={} maxDD={} winRate={} PF={}",
                totalReturn, sharpeRatio, maxDrawdown, metrics.getWinRate(), metrics.getProfitFactor());
        return metrics;
    }

    /** Returns of every snapshot after the first, relative to the previous snapshot. */
    double[] dailyReturns(List<DailySnapshot> history) {
        if (history.size() < 2) {
            return new double[0];
        }
        return history.subList(1, history.size()).stream()
                .mapToDouble(DailySnapshot::getDailyReturn)
                .toArray();
    }

    /** (1 + mean daily return)^252 - 1, or 0 without returns. */
    double annualizedReturn(double[] dailyReturns) {
        if (dailyReturns.length == 0) {
            return 0;
        }
        return Math.pow(1 + StatUtils.mean(dailyReturns), TRADING_DAYS_PER_YEAR) - 1;
    }

    /** Population standard deviation of daily returns x sqrt(252). */
    double annualizedVolatility(double[] dailyReturns) {
        if (dailyReturns.length == 0) {
            return 0;
        }
        return new StandardDeviation(false).evaluate(dailyReturns) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /** Root mean square of the negative daily returns x sqrt(252). */
    double downsideDeviation(double[] dailyReturns) {
        double[] negative = Arrays.stream(dailyReturns).filter(r -> r < 0).toArray();
        if (negative.length == 0) {
            return 0;
        }
        return Math.sqrt(StatUtils.sumSq(negative) / negative.length) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    /**
     * Largest decline from a running peak of total value, as a fraction of that peak.
     * Zero when the value never falls below a previous peak.
     */
    double maxDrawdown(List<DailySnapshot> history) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDrawdown = 0;
        for (DailySnapshot snapshot : history) {
            double value = snapshot.getTotalValue().doubleValue();
            peak = Math.max(peak, value);
            if (peak > 0) {
                maxDrawdown = Math.min(maxDrawdown, (value - peak) / peak);
            }
        }
        return maxDrawdown;
    }

    /**
     * Gross profit / gross loss. Positive infinity with no losing positions, zero with no
     * closed positions at all.
     */
    double profitFactor(int closedCount, BigDecimal grossProfit, BigDecimal grossLoss) {
        if (closedCount == 0) {
            return 0;
        }
        if (grossLoss.signum() == 0) {
            return Double.POSITIVE_INFINITY;
        }
        return grossProfit.doubleValue() / grossLoss.doubleValue();
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return sum(values).divide(BigDecimal.valueOf(values.size()), MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
