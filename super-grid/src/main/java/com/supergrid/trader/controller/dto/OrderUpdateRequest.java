package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.OrderUpdate;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderUpdateRequest {

    @NotBlank(message = "Order id is required")
    private String orderId;

    @NotNull(message = "Active flag is required")
    private Boolean active;

    private String status;

    public OrderUpdate toOrderUpdate() {
        return OrderUpdate.builder()
                .orderId(orderId)
                .active(Boolean.TRUE.equals(active))
                .status(status)
                .build();
    }
}
