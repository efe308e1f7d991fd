package com.supergrid.trader.service;

import com.supergrid.trader.controller.dto.EvaluationResponse;
import com.supergrid.trader.controller.dto.GridStatusResponse;
import com.supergrid.trader.domain.BarData;
import com.supergrid.trader.domain.Fill;
import com.supergrid.trader.domain.GatewayMode;
import com.supergrid.trader.domain.GridConfig;
import com.supergrid.trader.domain.GridStateListener;
import com.supergrid.trader.domain.GridTrader;
import com.supergrid.trader.domain.OrderGateway;
import com.supergrid.trader.domain.OrderIntent;
import com.supergrid.trader.domain.OrderUpdate;
import com.supergrid.trader.domain.PositionSync;
import com.supergrid.trader.domain.TickData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Implementation of GridTradingService. Hosts at most one grid and
 * serializes every event delivered to it, whether it comes from the REST
 * API or from the execution report worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GridTradingServiceImpl implements GridTradingService {

    private static final String MDC_SYMBOL = "symbol";

    private final GridConfigFactory gridConfigFactory;
    private final OrderGateway orderGateway;
    private final GridStateListener gridStateListener;
    private final GridMetricsService metricsService;

    private final ReentrantLock lock = new ReentrantLock();

    private GridTrader trader;

    @Override
    public GridStatusResponse start(Map<String, Object> settings) {
        lock.lock();
        try {
            if (trader != null && trader.isActive()) {
                throw new GridAlreadyRunningException(trader.getConfig().getVtSymbol());
            }

            GridConfig config = gridConfigFactory.createConfig(settings);
            MDC.put(MDC_SYMBOL, config.getVtSymbol());
            try {
                GridTrader newTrader = new GridTrader(config, orderGateway, gridStateListener);
                newTrader.start();
                trader = newTrader;
                return toStatus(newTrader, "Grid started");
            } finally {
                MDC.remove(MDC_SYMBOL);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public GridStatusResponse stop() {
        return withTrader(t -> {
            if (t.isActive()) {
                t.stop();
                log.info(metricsService.getMetricsSummary());
                return toStatus(t, "Grid stopped");
            }
            return toStatus(t, "Grid already stopped");
        });
    }

    @Override
    public GridStatusResponse getStatus() {
        return withTrader(t -> toStatus(t, t.isActive() ? "Grid running" : "Grid stopped"));
    }

    @Override
    public EvaluationResponse onTick(TickData tick) {
        return withTrader(t -> toEvaluation(t, t.isActive() ? recordCycle(t.onTick(tick)) : List.of()));
    }

    @Override
    public EvaluationResponse onBar(BarData bar) {
        return withTrader(t -> {
            if (!t.isActive() || orderGateway.mode() != GatewayMode.BACKTEST) {
                return toEvaluation(t, t.onBar(bar));
            }
            return toEvaluation(t, recordCycle(t.onBar(bar)));
        });
    }

    @Override
    public GridStatusResponse onFill(Fill fill) {
        return withTrader(t -> {
            t.onFill(fill);
            return toStatus(t, "Fill applied");
        });
    }

    @Override
    public GridStatusResponse onOrderUpdate(OrderUpdate update) {
        return withTrader(t -> {
            t.onOrderUpdate(update);
            return toStatus(t, "Order update applied");
        });
    }

    @Override
    public GridStatusResponse onPosition(PositionSync sync) {
        return withTrader(t -> {
            t.onPosition(sync);
            return toStatus(t, "Position synced");
        });
    }

    /**
     * Run an action against the current grid under the lock, with its symbol
     * in the logging context.
     */
    private <T> T withTrader(Function<GridTrader, T> action) {
        lock.lock();
        try {
            if (trader == null) {
                throw new GridNotRunningException();
            }
            MDC.put(MDC_SYMBOL, trader.getConfig().getVtSymbol());
            try {
                return action.apply(trader);
            } finally {
                MDC.remove(MDC_SYMBOL);
            }
        } finally {
            lock.unlock();
        }
    }

    private List<OrderIntent> recordCycle(List<OrderIntent> sent) {
        metricsService.recordEvaluation();
        for (OrderIntent intent : sent) {
            metricsService.recordIntentSent(intent.getDirection());
        }
        return sent;
    }

    private GridStatusResponse toStatus(GridTrader t, String message) {
        return GridStatusResponse.builder()
                .symbol(t.getConfig().getVtSymbol())
                .active(t.isActive())
                .gatewayMode(orderGateway.mode())
                .state(t.getSnapshot())
                .message(message)
                .build();
    }

    private EvaluationResponse toEvaluation(GridTrader t, List<OrderIntent> sent) {
        return EvaluationResponse.builder()
                .symbol(t.getConfig().getVtSymbol())
                .intents(sent)
                .state(t.getSnapshot())
                .build();
    }
}
