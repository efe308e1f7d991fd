package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A single market tick with the first level of the order book.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickData {

    private String symbol;
    private LocalDateTime datetime;
    private BigDecimal lastPrice;
    private BigDecimal bidPrice1;
    private BigDecimal askPrice1;
}
