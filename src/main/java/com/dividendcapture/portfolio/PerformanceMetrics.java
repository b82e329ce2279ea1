package com.dividendcapture.portfolio;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Final performance figures of a backtest run.
 *
 * <p>Ratios and returns are fractions (0.05 = 5%). {@code maxDrawdown} is the largest
 * peak-to-trough decline of total value and is zero or negative. {@code profitFactor} is
 * positive infinity when there are closed winners but no losers.
 */
@Value
@Builder
public class PerformanceMetrics {

    BigDecimal initialCapital;
    BigDecimal finalValue;

    // Returns
    double totalReturn;
    double annualizedReturn;

    // Risk
    double annualizedVolatility;
    double downsideDeviation;
    double maxDrawdown;

    // Risk-adjusted
    double sharpeRatio;
    double sortinoRatio;
    double calmarRatio;

    // Trading statistics
    int totalTrades;
    int buyTrades;
    int sellTrades;
    int closedPositions;
    int winningTrades;
    int losingTrades;
    double winRate;
    double profitFactor;
    BigDecimal avgProfit;
    BigDecimal avgLoss;
    double avgHoldingDays;
    BigDecimal totalRealizedPnl;
    BigDecimal totalCommission;

    // Dividends
    BigDecimal totalDividend;
    int positionsWithDividend;
    BigDecimal avgDividendPerPosition;

    /**
     * Flat key to number mapping, in a fixed order, for the metrics export. JSON has no
     * infinity, so an infinite {@code profit_factor} is written as null.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("initial_capital", initialCapital);
        map.put("final_value", finalValue);
        map.put("total_return", totalReturn);
        map.put("annualized_return", annualizedReturn);
        map.put("annualized_volatility", annualizedVolatility);
        map.put("downside_deviation", downsideDeviation);
        map.put("max_drawdown", maxDrawdown);
        map.put("sharpe_ratio", sharpeRatio);
        map.put("sortino_ratio", sortinoRatio);
        map.put("calmar_ratio", calmarRatio);
        map.put("total_trades", totalTrades);
        map.put("buy_trades", buyTrades);
        map.put("sell_trades", sellTrades);
        map.put("closed_positions", closedPositions);
        map.put("winning_trades", winningTrades);
        map.put("losing_trades", losingTrades);
        map.put("win_rate", winRate);
        map.put("profit_factor", Double.isFinite(profitFactor) ? profitFactor : null);
        map.put("avg_profit", avgProfit);
        map.put("avg_loss", avgLoss);
        map.put("avg_holding_days", avgHoldingDays);
        map.put("total_realized_pnl", totalRealizedPnl);
        map.put("total_commission", totalCommission);
        map.put("total_dividend", totalDividend);
        map.put("positions_with_dividend", positionsWithDividend);
        map.put("avg_dividend_per_position", avgDividendPerPosition);
        return map;
    }
}
