package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.BarData;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Request DTO for a backtest bar. Only the close drives the grid.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BarRequest {

    private String symbol;

    private LocalDateTime datetime;

    private BigDecimal open;

    private BigDecimal high;

    private BigDecimal low;

    @NotNull(message = "Close price is required")
    @Positive(message = "Close price must be positive")
    private BigDecimal close;

    private Long volume;

    public BarData toBarData() {
        return BarData.builder()
                .symbol(symbol)
                .datetime(datetime)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(volume)
                .build();
    }
}
