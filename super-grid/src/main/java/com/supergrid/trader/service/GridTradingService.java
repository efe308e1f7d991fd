package com.supergrid.trader.service;

import com.supergrid.trader.controller.dto.EvaluationResponse;
import com.supergrid.trader.controller.dto.GridStatusResponse;
import com.supergrid.trader.domain.BarData;
import com.supergrid.trader.domain.Fill;
import com.supergrid.trader.domain.OrderUpdate;
import com.supergrid.trader.domain.PositionSync;
import com.supergrid.trader.domain.TickData;

import java.util.Map;

/**
 * Service interface for running a single grid and feeding it events.
 */
public interface GridTradingService {

    /**
     * Start a grid with the given settings.
     *
     * @param settings grid options keyed by option name
     * @return the status of the new grid
     * @throws GridAlreadyRunningException if a grid is already active
     */
    GridStatusResponse start(Map<String, Object> settings);

    /**
     * Stop the running grid and cancel its working orders.
     *
     * @return the final status
     * @throws GridNotRunningException if no grid was started
     */
    GridStatusResponse stop();

    GridStatusResponse getStatus();

    EvaluationResponse onTick(TickData tick);

    /**
     * Feed a bar close. Only a backtest gateway acts on bars.
     */
    EvaluationResponse onBar(BarData bar);

    GridStatusResponse onFill(Fill fill);

    GridStatusResponse onOrderUpdate(OrderUpdate update);

    GridStatusResponse onPosition(PositionSync sync);
}
