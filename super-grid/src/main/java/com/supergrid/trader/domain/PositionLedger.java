package com.supergrid.trader.domain;

import lombok.extern.slf4j.Slf4j;

/**
 * Applies executions and position syncs back onto the grid state.
 * Shares single-writer access to {@link GridState} with the state machine.
 */
@Slf4j
public class PositionLedger {

    private final GridState state;

    public PositionLedger(GridState state) {
        this.state = state;
    }

    /**
     * A buy fill disarms the sell side, a sell fill disarms the buy side, and
     * either re-anchors the trigger on the executed price.
     */
    public void onFill(Fill fill) {
        if (fill.getDirection() == Direction.LONG) {
            state.setPosition(state.getPosition().add(fill.getVolume()));
            state.disarmUp();
        } else {
            state.setPosition(state.getPosition().subtract(fill.getVolume()));
            state.disarmDown();
        }
        state.setTriggerPrice(fill.getPrice());

        log.info("Fill applied: {} {} @ {}, position now {}",
                fill.getDirection(), fill.getVolume(), fill.getPrice(), state.getPosition());
    }

    /**
     * A finished order only frees the pending slot. Armed flags and extremes
     * stay so the next qualifying price re-attempts the trade.
     */
    public void onOrderUpdate(OrderUpdate update) {
        if (update.isActive()) {
            return;
        }
        String pending = state.getPendingOrderId();
        if (pending != null && pending.equals(update.getOrderId())) {
            state.setPendingOrderId(null);
            log.debug("Order {} finished ({}), pending slot cleared", update.getOrderId(), update.getStatus());
        }
    }

    /**
     * Overwrite the position with the venue's figure. An unset trigger is
     * seeded from the reported price.
     */
    public void onPositionSync(PositionSync sync) {
        state.setPosition(sync.getVolume());
        if (!PriceMath.isPositive(state.getTriggerPrice()) && sync.getPrice() != null) {
            state.setTriggerPrice(sync.getPrice());
            log.info("Trigger price seeded from position price {}", sync.getPrice());
        }
    }
}
