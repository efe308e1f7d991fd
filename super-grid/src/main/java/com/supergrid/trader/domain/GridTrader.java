package com.supergrid.trader.domain;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One running grid: owns its state, feeds price updates through the state
 * machine, routes the resulting intents to the gateway and applies the
 * gateway's executions through the ledger.
 */
@Slf4j
public class GridTrader implements GatewayEventListener {

    private final GridConfig config;
    private final GridState state;
    private final GridStateMachine stateMachine;
    private final PositionLedger ledger;
    private final OrderGateway gateway;
    private final GridStateListener listener;

    private boolean active;

    /**
     * @throws GridConfigurationException if the config is inconsistent
     */
    public GridTrader(GridConfig config, OrderGateway gateway, GridStateListener listener) {
        config.validate();
        this.config = config;
        this.state = GridState.initial(config);
        this.gateway = gateway;
        this.listener = listener;
        this.stateMachine = new GridStateMachine(config, state, gateway, listener);
        this.ledger = new PositionLedger(state);
    }

    public void start() {
        active = true;
        log.info("Grid started for {} in {} mode, corridor [{}, {}], trigger {}",
                config.getVtSymbol(), gateway.mode(), config.getLowerPrice(),
                config.getUpperPrice(), state.getTriggerPrice());
        notifyListener();
    }

    public void stop() {
        active = false;
        gateway.cancelAll(config.getVtSymbol());
        log.info("Grid stopped for {}, final position {}", config.getVtSymbol(), state.getPosition());
        notifyListener();
    }

    public boolean isActive() {
        return active;
    }

    public List<OrderIntent> onTick(TickData tick) {
        return onSnapshot(MarketSnapshotAdapter.fromTick(tick));
    }

    /**
     * Bar closes drive the grid only on a backtest gateway; live grids run
     * on ticks.
     */
    public List<OrderIntent> onBar(BarData bar) {
        if (gateway.mode() != GatewayMode.BACKTEST) {
            log.debug("Ignoring bar for {} on a {} gateway", config.getVtSymbol(), gateway.mode());
            return Collections.emptyList();
        }
        return onSnapshot(MarketSnapshotAdapter.fromBar(bar));
    }

    /**
     * Run one grid cycle and send whatever it releases.
     *
     * @return the intents that were sent
     */
    public List<OrderIntent> onSnapshot(MarketSnapshot snapshot) {
        if (!active) {
            log.debug("Grid for {} is not active, snapshot ignored", config.getVtSymbol());
            return Collections.emptyList();
        }

        // executions against earlier orders land before the next decision
        gateway.matchOrders(snapshot, this);

        List<OrderIntent> intents = stateMachine.evaluate(snapshot);
        if (intents.isEmpty()) {
            return intents;
        }

        // one pending slot: when a cycle sends both sides, the buy sent last is the one tracked
        List<OrderIntent> sent = new ArrayList<>(intents.size());
        for (OrderIntent intent : intents) {
            try {
                String orderId = gateway.sendOrder(intent);
                state.setPendingOrderId(orderId);
                sent.add(intent);
                log.info("Order {} sent: {} {} {} @ {}", orderId, intent.getDirection(),
                        intent.getVolume(), intent.getSymbol(), intent.getPrice());
            } catch (RuntimeException e) {
                log.error("Gateway rejected {} {} @ {}: {}", intent.getDirection(),
                        intent.getVolume(), intent.getPrice(), e.getMessage(), e);
            }
        }
        notifyListener();
        return sent;
    }

    @Override
    public void onFill(Fill fill) {
        ledger.onFill(fill);
        try {
            listener.onFillApplied(config.getVtSymbol(), fill);
        } catch (RuntimeException e) {
            log.error("Fill listener failed for {}: {}", config.getVtSymbol(), e.getMessage(), e);
        }
        notifyListener();
    }

    @Override
    public void onOrderUpdate(OrderUpdate update) {
        ledger.onOrderUpdate(update);
        notifyListener();
    }

    public void onPosition(PositionSync sync) {
        ledger.onPositionSync(sync);
        notifyListener();
    }

    public GridConfig getConfig() {
        return config;
    }

    public GridStateSnapshot getSnapshot() {
        return state.toSnapshot();
    }

    private void notifyListener() {
        try {
            listener.onStateChanged(config.getVtSymbol(), state.toSnapshot());
        } catch (RuntimeException e) {
            log.error("State listener failed for {}: {}", config.getVtSymbol(), e.getMessage(), e);
        }
    }
}
