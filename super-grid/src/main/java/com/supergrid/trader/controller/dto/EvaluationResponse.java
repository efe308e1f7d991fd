package com.supergrid.trader.controller.dto;

import com.supergrid.trader.domain.GridStateSnapshot;
import com.supergrid.trader.domain.OrderIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for one grid cycle: the orders it sent and the state after it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvaluationResponse {

    private String symbol;
    private List<OrderIntent> intents;
    private GridStateSnapshot state;
}
