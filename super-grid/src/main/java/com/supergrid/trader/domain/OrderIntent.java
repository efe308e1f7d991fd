package com.supergrid.trader.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * An order the grid wants placed. Becomes a real order once the gateway
 * accepts it and returns an id.
 */
@Value
@Builder
public class OrderIntent {

    String symbol;
    Direction direction;
    BigDecimal price;
    BigDecimal volume;
    OrderType orderType;
    Offset offset;

    public boolean isBuy() {
        return direction == Direction.LONG;
    }
}
