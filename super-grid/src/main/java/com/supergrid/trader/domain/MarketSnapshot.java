package com.supergrid.trader.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Normalized price update consumed by the grid: last trade plus top of book.
 */
@Value
@Builder
public class MarketSnapshot {

    BigDecimal lastPrice;
    BigDecimal bidPrice;
    BigDecimal askPrice;
}
