package com.supergrid.trader.infrastructure;

import com.supergrid.trader.domain.Direction;
import com.supergrid.trader.domain.Fill;
import com.supergrid.trader.domain.OrderUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Execution event published by the external executor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExecutionReport {

    private ReportType type;
    private String orderId;
    private String symbol;
    private Direction direction;
    private BigDecimal price;
    private BigDecimal volume;
    private Boolean active;
    private String status;

    public enum ReportType {
        FILL, ORDER_UPDATE
    }

    public Fill toFill() {
        return Fill.builder()
                .orderId(orderId)
                .symbol(symbol)
                .direction(direction)
                .price(price)
                .volume(volume)
                .time(LocalDateTime.now())
                .build();
    }

    public OrderUpdate toOrderUpdate() {
        return OrderUpdate.builder()
                .orderId(orderId)
                .active(Boolean.TRUE.equals(active))
                .status(status)
                .build();
    }
}
