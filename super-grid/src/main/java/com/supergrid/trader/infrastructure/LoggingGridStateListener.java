package com.supergrid.trader.infrastructure;

import com.supergrid.trader.domain.Fill;
import com.supergrid.trader.domain.GridStateListener;
import com.supergrid.trader.domain.GridStateSnapshot;
import com.supergrid.trader.service.GridMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Observability sink: logs grid state changes and mirrors them into metrics.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingGridStateListener implements GridStateListener {

    private final GridMetricsService metricsService;

    private GridStateSnapshot previous;

    @Override
    public synchronized void onStateChanged(String symbol, GridStateSnapshot snapshot) {
        if (snapshot.equals(previous)) {
            return;
        }

        log.debug("{} state: position={}, pending={}, touchUp={}, touchDn={}, low={}, high={}, trigger={}, sleep={}",
                symbol, snapshot.getPosition(), snapshot.getPendingOrderId(),
                snapshot.isTouchUp(), snapshot.isTouchDn(), snapshot.getLowestPrice(),
                snapshot.getHighestPrice(), snapshot.getTriggerPrice(), snapshot.isGridSleep());

        if (snapshot.isGridSleep() && (previous == null || !previous.isGridSleep())) {
            metricsService.recordSleepEntered();
        }
        metricsService.updateState(snapshot);
        previous = snapshot;
    }

    @Override
    public void onFillApplied(String symbol, Fill fill) {
        metricsService.recordFill();
    }
}
