package com.supergrid.trader.infrastructure;

import com.supergrid.trader.service.GridTradingService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Manages the lifecycle of the execution report worker in live mode.
 * Starts it on application startup and shuts it down gracefully.
 */
@Component
@ConditionalOnProperty(name = "grid.gateway.mode", havingValue = "live")
@RequiredArgsConstructor
@Slf4j
public class WorkerManager {

    private final ExecutorService reportWorkerExecutorService;
    private final ExecutionReportQueue executionReportQueue;
    private final GridTradingService gridTradingService;

    private ExecutionReportWorker worker;

    @PostConstruct
    public void startWorker() {
        worker = new ExecutionReportWorker(executionReportQueue, gridTradingService, "ExecutionReportWorker-1");
        reportWorkerExecutorService.submit(worker);
        log.info("Execution report worker started");
    }

    @PreDestroy
    public void stopWorker() {
        log.info("Stopping execution report worker...");

        if (worker != null) {
            worker.stop();
        }
        reportWorkerExecutorService.shutdown();

        try {
            if (!reportWorkerExecutorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Worker did not terminate gracefully, forcing shutdown");
                reportWorkerExecutorService.shutdownNow();
            } else {
                log.info("Execution report worker stopped gracefully");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for worker to stop", e);
            reportWorkerExecutorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
