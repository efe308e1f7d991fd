package com.supergrid.trader.infrastructure;

import com.supergrid.trader.service.GridNotRunningException;
import com.supergrid.trader.service.GridTradingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

/**
 * Background worker that polls execution reports and applies them to the
 * running grid. Runs in its own thread until stopped.
 */
@RequiredArgsConstructor
@Slf4j
public class ExecutionReportWorker implements Runnable {

    private final ExecutionReportQueue reportQueue;
    private final GridTradingService gridTradingService;
    private final String workerName;

    private volatile boolean running = true;

    @Override
    public void run() {
        log.info("{} started and polling execution reports", workerName);

        while (running) {
            try {
                ExecutionReport report = reportQueue.pop();
                if (report != null) {
                    dispatch(report);
                }
            } catch (Exception e) {
                log.error("{} encountered error while polling reports: {}",
                        workerName, e.getMessage(), e);

                // Brief pause before retrying to avoid tight loop on persistent errors
                try {
                    Thread.sleep(1000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during error recovery", workerName);
                    break;
                }
            }
        }

        log.info("{} stopped", workerName);
    }

    /**
     * Route one report to the grid.
     */
    void dispatch(ExecutionReport report) {
        if (report.getType() == null || report.getOrderId() == null) {
            log.warn("{} - Ignoring report without type or order id: {}", workerName, report);
            return;
        }

        if (report.getType() == ExecutionReport.ReportType.FILL
                && (report.getDirection() == null || report.getPrice() == null || report.getVolume() == null)) {
            log.warn("{} - Ignoring fill {} without direction, price or volume: {}",
                    workerName, report.getOrderId(), report);
            return;
        }

        MDC.put("orderId", report.getOrderId());
        try {
            switch (report.getType()) {
                case FILL -> gridTradingService.onFill(report.toFill());
                case ORDER_UPDATE -> gridTradingService.onOrderUpdate(report.toOrderUpdate());
            }
        } catch (GridNotRunningException e) {
            log.warn("Dropping {} report: no grid is running", report.getType());
        } finally {
            MDC.remove("orderId");
        }
    }

    /**
     * Gracefully stop the worker.
     */
    public void stop() {
        log.info("Stopping {}", workerName);
        running = false;
    }
}
