package com.dividendcapture.domain.model;

import java.math.BigDecimal;
import lombok.Value;

/** Cash and open-position count used by the strategy's pre-trade validation. */
@Value
public class PortfolioContext {

    BigDecimal cash;
    int openPositionCount;
}
