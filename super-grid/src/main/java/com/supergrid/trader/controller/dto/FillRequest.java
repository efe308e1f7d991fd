package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.Direction;
import com.supergrid.trader.domain.Fill;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FillRequest {

    @NotBlank(message = "Order id is required")
    private String orderId;

    private String symbol;

    @NotNull(message = "Direction is required")
    private Direction direction;

    @NotNull(message = "Price is required")
    @Positive(message = "Price must be positive")
    private BigDecimal price;

    @NotNull(message = "Volume is required")
    @Positive(message = "Volume must be positive")
    private BigDecimal volume;

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
}
