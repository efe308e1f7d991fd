package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.TickData;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Request DTO for a market tick. Bid and ask are optional and fall back to
 * the last price.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TickRequest {

    private String symbol;

    private LocalDateTime datetime;

    @NotNull(message = "Last price is required")
    @Positive(message = "Last price must be positive")
    private BigDecimal lastPrice;

    @Positive(message = "Bid price must be positive")
    private BigDecimal bidPrice;

    @Positive(message = "Ask price must be positive")
    private BigDecimal askPrice;

    public TickData toTickData() {
        return TickData.builder()
                .symbol(symbol)
                .datetime(datetime != null ? datetime : LocalDateTime.now())
                .lastPrice(lastPrice)
                .bidPrice1(bidPrice)
                .askPrice1(askPrice)
                .build();
    }
}
