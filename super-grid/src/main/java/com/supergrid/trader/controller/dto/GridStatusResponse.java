package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.GatewayMode;
import com.supergrid.trader.domain.GridStateSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO describing the running grid.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridStatusResponse {

    private String symbol;
    private boolean active;
    private GatewayMode gatewayMode;
    private GridStateSnapshot state;
    private String message;
}
