package com.dividendcapture.pnl;

import com.dividendcapture.config.ExecutionConfig;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Simulated execution costs for cash equity fills.
 *
 * <ul>
 *   <li><b>Slippage:</b> buys fill at close x (1 + slippage), sells at close x (1 - slippage).
 *       On the instrument's ex-dividend date the wider ex-date slippage applies.</li>
 *   <li><b>Commission:</b> notional x rate, clamped to [min, max], rounded to 2 decimals.</li>
 *   <li><b>Dividend tax:</b> gross dividend per share x (1 - tax rate).</li>
 * </ul>
 */
public class ExecutionCostModel {

    private static final int MONEY_SCALE = 2;

    private final ExecutionConfig config;

    public ExecutionCostModel(ExecutionConfig config) {
        this.config = config;
    }

    public BigDecimal buyFillPrice(BigDecimal close, boolean exDividendDate) {
        return close.multiply(BigDecimal.ONE.add(slippage(exDividendDate)));
    }

    public BigDecimal sellFillPrice(BigDecimal close, boolean exDividendDate) {
        return close.multiply(BigDecimal.ONE.subtract(slippage(exDividendDate)));
    }

    /**
     * @param price  fill price per share
     * @param shares shares traded (always positive)
     * @return commission for one order
     */
    public BigDecimal commission(BigDecimal price, int shares) {
        BigDecimal raw = price.multiply(BigDecimal.valueOf(shares)).multiply(config.getCommissionRate());
        BigDecimal clamped = raw.max(config.getMinCommission()).min(config.getMaxCommission());
        return clamped.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /** Dividend per share after withholding tax. */
    public BigDecimal netDividendPerShare(BigDecimal grossPerShare) {
        return grossPerShare.multiply(BigDecimal.ONE.subtract(config.getDividendTaxRate()));
    }

    private BigDecimal slippage(boolean exDividendDate) {
        return exDividendDate ? config.getSlippageExDate() : config.getSlippage();
    }
}
