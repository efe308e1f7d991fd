package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Order status change reported by the gateway. An inactive order is
 * finished: filled, cancelled or rejected.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrderUpdate {

    private String orderId;
    private boolean active;
    private String status;
}
