package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Represents an execution reported by the order gateway.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Fill {

    private String orderId;
    private String symbol;
    private Direction direction;
    private BigDecimal price;
    private BigDecimal volume;
    private LocalDateTime time;

    /**
     * Notional value of the execution.
     */
    public BigDecimal getTotalValue() {
        return price.multiply(volume);
    }
}
