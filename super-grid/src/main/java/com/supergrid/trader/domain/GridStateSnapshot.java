package com.supergrid.trader.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Read-only copy of {@link GridState} handed to observers.
 */
@Value
@Builder
public class GridStateSnapshot {

    BigDecimal position;
    String pendingOrderId;
    boolean touchUp;
    boolean touchDn;
    BigDecimal lowestPrice;
    BigDecimal highestPrice;
    BigDecimal triggerPrice;
    boolean gridSleep;
}
