package com.supergrid.trader.domain;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Core of the grid: evaluates each price snapshot against the corridor and
 * the hysteresis bands and decides which orders to place.
 *
 * <p>Not thread-safe. Snapshots must be fed one at a time, in arrival order,
 * with fills applied through {@link PositionLedger} between calls.
 */
@Slf4j
public class GridStateMachine {

    private final GridConfig config;
    private final GridState state;
    private final OrderGateway gateway;
    private final GridStateListener listener;

    public GridStateMachine(GridConfig config, GridState state,
                            OrderGateway gateway, GridStateListener listener) {
        this.config = config;
        this.state = state;
        this.gateway = gateway;
        this.listener = listener;
    }

    /**
     * Run one grid cycle.
     *
     * @param snapshot the latest normalized price update
     * @return the intents released this cycle: at most one sell and one buy
     */
    public List<OrderIntent> evaluate(MarketSnapshot snapshot) {
        if (snapshot == null || snapshot.getLastPrice() == null) {
            log.warn("Skipping grid cycle for {}: snapshot without last price", config.getVtSymbol());
            notifyListener();
            return Collections.emptyList();
        }

        BigDecimal last = snapshot.getLastPrice();
        BigDecimal bid = snapshot.getBidPrice() != null ? snapshot.getBidPrice() : last;
        BigDecimal ask = snapshot.getAskPrice() != null ? snapshot.getAskPrice() : last;

        checkCorridor(last);
        if (state.isGridSleep()) {
            notifyListener();
            return Collections.emptyList();
        }

        if (!PriceMath.isPositive(state.getTriggerPrice())) {
            log.warn("Skipping grid cycle for {}: trigger price {} is not positive",
                    config.getVtSymbol(), state.getTriggerPrice());
            notifyListener();
            return Collections.emptyList();
        }

        armUp(last);
        armDown(last);

        List<OrderIntent> intents = new ArrayList<>(2);
        releaseSell(last, bid, intents);
        releaseBuy(last, ask, intents);

        notifyListener();
        return intents;
    }

    /**
     * Sleep outside {@code [lower, upper]}, wake inside it. Bounds are inclusive.
     */
    private void checkCorridor(BigDecimal last) {
        boolean outside = last.compareTo(config.getUpperPrice()) > 0
                || last.compareTo(config.getLowerPrice()) < 0;

        if (outside) {
            if (!state.isGridSleep()) {
                state.setGridSleep(true);
                log.info("Grid sleeping: last {} outside [{}, {}]",
                        last, config.getLowerPrice(), config.getUpperPrice());
                requestCancelAll();
            } else if (state.getPendingOrderId() != null) {
                requestCancelAll();
            }
        } else if (state.isGridSleep()) {
            state.setGridSleep(false);
            log.info("Grid running: last {} back inside [{}, {}]",
                    last, config.getLowerPrice(), config.getUpperPrice());
        }
    }

    private void armUp(BigDecimal last) {
        BigDecimal trigger = state.getTriggerPrice();
        if (last.compareTo(trigger) <= 0) {
            return;
        }
        BigDecimal risePct = PriceMath.percentOf(last.subtract(trigger), trigger);
        if (risePct.compareTo(config.getRisePercent()) >= 0) {
            state.setTouchUp(true);
            BigDecimal highest = state.getHighestPrice();
            state.setHighestPrice(highest == null ? last : highest.max(last));
        }
    }

    private void armDown(BigDecimal last) {
        BigDecimal trigger = state.getTriggerPrice();
        if (last.compareTo(trigger) >= 0) {
            return;
        }
        BigDecimal fallPct = PriceMath.percentOf(trigger.subtract(last), trigger);
        if (fallPct.compareTo(config.getFallPercent()) >= 0) {
            state.setTouchDn(true);
            BigDecimal lowest = state.getLowestPrice();
            state.setLowestPrice(lowest == null ? last : lowest.min(last));
        }
    }

    private void releaseSell(BigDecimal last, BigDecimal bid, List<OrderIntent> intents) {
        if (!state.isTouchUp()) {
            return;
        }
        BigDecimal highest = state.getHighestPrice();
        if (!PriceMath.isPositive(highest)) {
            log.warn("Sell side of {} armed without a positive high ({}), skipping release",
                    config.getVtSymbol(), highest);
            return;
        }

        BigDecimal fallDownPct = PriceMath.percentOf(highest.subtract(last), highest);
        if (fallDownPct.compareTo(config.getFallDown()) < 0) {
            return;
        }

        SizedOrder sell = OrderSizer.sizeSell(config, state, last, bid);
        if (!sell.isExecutable()) {
            log.debug("Sell release suppressed for {}: bias {}%",
                    config.getVtSymbol(), sell.getBias());
            return;
        }

        log.info("Sell released: last {}, trigger {}, high {}, retrace {}%",
                last, state.getTriggerPrice(), highest, fallDownPct);
        if (sell.hasVolume()) {
            intents.add(OrderIntent.builder()
                    .symbol(config.getVtSymbol())
                    .direction(Direction.SHORT)
                    .price(sell.getPrice())
                    .volume(sell.getVolume())
                    .orderType(config.getOrderType())
                    .offset(Offset.CLOSE)
                    .build());
        } else {
            log.info("Sell release for {} clamped to zero volume by the position limit, nothing sent",
                    config.getVtSymbol());
        }
        state.disarmUp();
        state.setTriggerPrice(sell.getPrice());
    }

    private void releaseBuy(BigDecimal last, BigDecimal ask, List<OrderIntent> intents) {
        if (!state.isTouchDn()) {
            return;
        }
        BigDecimal lowest = state.getLowestPrice();
        if (!PriceMath.isPositive(lowest)) {
            log.warn("Buy side of {} armed without a positive low ({}), skipping release",
                    config.getVtSymbol(), lowest);
            return;
        }
        // the sell branch may have re-anchored the trigger to a non-positive price
        if (!PriceMath.isPositive(state.getTriggerPrice())) {
            log.warn("Buy side of {} skipped: trigger price {} is not positive",
                    config.getVtSymbol(), state.getTriggerPrice());
            return;
        }

        BigDecimal riseUpPct = PriceMath.percentOf(last.subtract(lowest), lowest);
        if (riseUpPct.compareTo(config.getRiseUp()) < 0) {
            return;
        }

        SizedOrder buy = OrderSizer.sizeBuy(config, state, last, ask);
        if (!buy.isExecutable()) {
            log.debug("Buy release suppressed for {}: bias {}%",
                    config.getVtSymbol(), buy.getBias());
            return;
        }

        log.info("Buy released: last {}, trigger {}, low {}, rebound {}%",
                last, state.getTriggerPrice(), lowest, riseUpPct);
        if (buy.hasVolume()) {
            intents.add(OrderIntent.builder()
                    .symbol(config.getVtSymbol())
                    .direction(Direction.LONG)
                    .price(buy.getPrice())
                    .volume(buy.getVolume())
                    .orderType(config.getOrderType())
                    .offset(Offset.OPEN)
                    .build());
        } else {
            log.info("Buy release for {} clamped to zero volume by the position limit, nothing sent",
                    config.getVtSymbol());
        }
        state.disarmDown();
        state.setTriggerPrice(buy.getPrice());
    }

    private void requestCancelAll() {
        try {
            gateway.cancelAll(config.getVtSymbol());
        } catch (RuntimeException e) {
            log.error("Cancel-all request for {} failed: {}", config.getVtSymbol(), e.getMessage(), e);
        }
    }

    private void notifyListener() {
        try {
            listener.onStateChanged(config.getVtSymbol(), state.toSnapshot());
        } catch (RuntimeException e) {
            log.error("State listener failed for {}: {}", config.getVtSymbol(), e.getMessage(), e);
        }
    }
}
