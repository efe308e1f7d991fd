package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Represents a single OHLCV bar.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarData {

    private LocalDateTime datetime;
    private String symbol;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;
}
