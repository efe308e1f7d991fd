package com.supergrid.trader.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Mutable state of a running grid. Owned by exactly one {@link GridTrader};
 * the state machine and the ledger are its only writers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GridState {

    private BigDecimal triggerPrice;

    private boolean touchUp;

    private boolean touchDn;

    /** Highest price seen since the sell side armed; null while disarmed. */
    private BigDecimal highestPrice;

    /** Lowest price seen since the buy side armed; null while disarmed. */
    private BigDecimal lowestPrice;

    private boolean gridSleep;

    @Builder.Default
    private BigDecimal position = BigDecimal.ZERO;

    /** Id of the most recently sent order until it finishes; null when none. */
    private String pendingOrderId;

    public static GridState initial(GridConfig config) {
        return GridState.builder()
                .triggerPrice(config.getTriggerPrice())
                .position(BigDecimal.ZERO)
                .build();
    }

    public void disarmUp() {
        touchUp = false;
        highestPrice = null;
    }

    public void disarmDown() {
        touchDn = false;
        lowestPrice = null;
    }

    public GridStateSnapshot toSnapshot() {
        return GridStateSnapshot.builder()
                .position(position)
                .pendingOrderId(pendingOrderId)
                .touchUp(touchUp)
                .touchDn(touchDn)
                .lowestPrice(lowestPrice)
                .highestPrice(highestPrice)
                .triggerPrice(triggerPrice)
                .gridSleep(gridSleep)
                .build();
    }
}
