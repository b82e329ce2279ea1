package com.dividendcapture.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.dividendcapture.domain.enums.PositionStatus;
import com.dividendcapture.domain.enums.SignalKind;
import com.dividendcapture.domain.model.DividendInfo;
import com.dividendcapture.domain.model.Position;
import com.dividendcapture.domain.model.PositionContext;
import com.dividendcapture.domain.model.Trade;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for Position: opening, additions, dividend credit and close accounting.
 */
class PositionTest {

    private static final String TICKER = "7203";
    private static final LocalDate ENTRY = LocalDate.of(2023, 3, 28);
    private static final LocalDate EX_DATE = LocalDate.of(2023, 3, 29);

    private DividendInfo dividend;
    private Position position;

    @BeforeEach
    void setUp() {
        dividend = DividendInfo.builder()
                .exDividendDate(EX_DATE)
                .recordDate(LocalDate.of(2023, 3, 31))
                .dividendPerShare(new BigDecimal("50"))
                .build();
        position = Position.open(buy(ENTRY, "2000", 500, "550"), dividend);
    }

    private static Trade buy(LocalDate date, String price, int shares, String commission) {
        return Trade.buy(TICKER, SignalKind.ENTRY, date, new BigDecimal(price), shares, new BigDecimal(commission), "test");
    }

    @Nested
    @DisplayName("Opening")
    class Opening {

        @Test
        @DisplayName("Opening trade is applied exactly once")
        void openingTradeCountedOnce() {
            assertThat(position.getShares()).isEqualTo(500);
            assertThat(position.getTrades()).hasSize(1);
            assertThat(position.sharesFromTrades()).isEqualTo(500);
            assertThat(position.getStatus()).isEqualTo(PositionStatus.OPEN);
        }

        @Test
        @DisplayName("Average cost starts at the fill price, excluding commission")
        void averageCostExcludesCommission() {
            assertThat(position.getAverageCost()).isEqualByComparingTo("2000");
            assertThat(position.getCostBasis()).isEqualByComparingTo("1000000");
            assertThat(position.getTotalCommission()).isEqualByComparingTo("550");
            assertThat(position.getInitialValue()).isEqualByComparingTo("1000000");
        }

        @Test
        @DisplayName("Dividend details are copied from the dividend info")
        void carriesDividendInfo() {
            assertThat(position.hasDividendInfo()).isTrue();
            assertThat(position.getExDividendDate()).isEqualTo(EX_DATE);
            assertThat(position.getDividendPerShare()).isEqualByComparingTo("50");
        }

        @Test
        @DisplayName("A SELL cannot open a position")
        void sellCannotOpen() {
            Trade sell = Trade.sell(TICKER, ENTRY, new BigDecimal("2000"), 100, BigDecimal.ZERO, "x");
            assertThatThrownBy(() -> Position.open(sell, dividend)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Position without dividend info")
        void withoutDividendInfo() {
            Position bare = Position.open(buy(ENTRY, "100", 100, "0"), null);
            assertThat(bare.hasDividendInfo()).isFalse();
            assertThat(bare.getExDividendDate()).isNull();
        }
    }

    @Nested
    @DisplayName("Additions")
    class Additions {

        @Test
        @DisplayName("Average cost is share-weighted over the buys")
        void averageCostWeighted() {
            position.addTrade(buy(EX_DATE, "1950", 300, "321.75"));

            assertThat(position.getShares()).isEqualTo(800);
            assertThat(position.getAverageCost()).isEqualByComparingTo("1981.25");
            assertThat(position.getCostBasis()).isEqualByComparingTo("1585000");
            assertThat(position.getTotalCommission()).isEqualByComparingTo("871.75");
            assertThat(position.getInitialShares()).isEqualTo(500);
            assertThat(position.getTrades()).hasSize(2);
        }

        @Test
        @DisplayName("Holding equals the sum of its trades after additions")
        void sharesMatchTrades() {
            position.addTrade(buy(EX_DATE, "1950", 200, "0"));
            assertThat(position.sharesFromTrades()).isEqualTo(position.getShares());
        }

        @Test
        @DisplayName("Trade for another instrument is rejected")
        void otherInstrumentRejected() {
            Trade other = Trade.buy("6758", SignalKind.ADD, EX_DATE, new BigDecimal("100"), 100, BigDecimal.ZERO, "x");
            assertThatThrownBy(() -> position.addTrade(other)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Shares held before the ex-date exclude same-day additions")
        void sharesHeldBeforeExDate() {
            position.addTrade(buy(EX_DATE, "1950", 200, "0"));
            assertThat(position.sharesHeldBefore(EX_DATE)).isEqualTo(500);
            assertThat(position.sharesHeldBefore(EX_DATE.plusDays(1))).isEqualTo(700);
        }
    }

    @Nested
    @DisplayName("Closing")
    class Closing {

        @Test
        @DisplayName("Realized P&L nets both commissions and includes the dividend")
        void realizedPnl() {
            position.creditDividend(new BigDecimal("50"), 500);
            Trade sell = Trade.sell(TICKER, LocalDate.of(2023, 4, 5), new BigDecimal("2050"), 500,
                    new BigDecimal("563.75"), "window_filled");

            position.close(sell, "window_filled");

            // (1,025,000 - 563.75) - (1,000,000 + 550) + 25,000
            assertThat(position.getRealizedPnL()).isEqualByComparingTo("48886.25");
            assertThat(position.getStatus()).isEqualTo(PositionStatus.CLOSED);
            assertThat(position.getShares()).isZero();
            assertThat(position.getExitReason()).isEqualTo("window_filled");
            assertThat(position.getExitPrice()).isEqualByComparingTo("2050");
            assertThat(position.getTotalCommission()).isEqualByComparingTo("1113.75");
            assertThat(position.sharesFromTrades()).isZero();
        }

        @Test
        @DisplayName("Partial close is refused")
        void partialCloseRefused() {
            Trade sell = Trade.sell(TICKER, EX_DATE, new BigDecimal("2000"), 100, BigDecimal.ZERO, "x");
            assertThatThrownBy(() -> position.close(sell, "x")).isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("Closed position refuses further trades")
        void closedIsTerminal() {
            position.close(Trade.sell(TICKER, EX_DATE, new BigDecimal("2000"), 500, BigDecimal.ZERO, "x"), "x");

            assertThatThrownBy(() -> position.addTrade(buy(EX_DATE, "2000", 100, "0")))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(position.marketValue(new BigDecimal("2100"))).isEqualByComparingTo("0");
            assertThat(position.unrealizedPnl(new BigDecimal("2100"))).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("Sold on or after the ex-date keeps the dividend, paid into realized P&L later")
        void dividendAfterClose() {
            position.close(Trade.sell(TICKER, EX_DATE, new BigDecimal("1980"), 500, BigDecimal.ZERO, "x"), "x");
            assertThat(position.getRealizedPnL()).isEqualByComparingTo("-10000");
            assertThat(position.dividendEntitledShares()).isEqualTo(500);
            assertThat(position.hasPendingDividend()).isTrue();

            BigDecimal amount = position.creditDividend(new BigDecimal("50"), position.dividendEntitledShares());

            assertThat(amount).isEqualByComparingTo("25000");
            assertThat(position.getDividendReceivedTotal()).isEqualByComparingTo("25000");
            assertThat(position.getRealizedPnL()).isEqualByComparingTo("15000");
            assertThat(position.hasPendingDividend()).isFalse();
        }

        @Test
        @DisplayName("Sold before the ex-date is not entitled to the dividend")
        void soldBeforeExDate() {
            position.close(Trade.sell(TICKER, ENTRY, new BigDecimal("2000"), 500, BigDecimal.ZERO, "x"), "x");

            assertThat(position.dividendEntitledShares()).isZero();
            assertThat(position.hasPendingDividend()).isFalse();
            assertThatThrownBy(() -> position.creditDividend(BigDecimal.ONE, 0))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    @DisplayName("Dividend can only be credited once")
    void dividendCreditedOnce() {
        BigDecimal amount = position.creditDividend(new BigDecimal("39.8425"), 500);

        assertThat(amount).isEqualByComparingTo("19921.25");
        assertThat(position.isDividendCredited()).isTrue();
        assertThatThrownBy(() -> position.creditDividend(new BigDecimal("39.8425"), 500))
                .isInstanceOf(IllegalStateException.class);
        assertThat(position.getDividendReceivedTotal()).isEqualByComparingTo("19921.25");
    }

    @Test
    @DisplayName("Unrealized P&L and context reflect the current holding")
    void valuationAndContext() {
        position.recordPreExPrice(new BigDecimal("2010"));

        assertThat(position.unrealizedPnl(new BigDecimal("2100"))).isEqualByComparingTo("50000");
        assertThat(position.marketValue(new BigDecimal("2100"))).isEqualByComparingTo("1050000");

        PositionContext context = position.toContext();
        assertThat(context.getTotalShares()).isEqualTo(500);
        assertThat(context.getPreExPrice()).isEqualByComparingTo("2010");
        assertThat(context.getExDividendDate()).isEqualTo(EX_DATE);
        assertThat(position.holdingDays(LocalDate.of(2023, 4, 7))).isEqualTo(10);
    }
}
