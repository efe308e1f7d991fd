package com.supergrid.trader.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread for the execution report worker. Live mode only.
 */
@Configuration
@ConditionalOnProperty(name = "grid.gateway.mode", havingValue = "live")
public class WorkerConfig {

    @Bean(name = "reportWorkerExecutorService")
    public ExecutorService reportWorkerExecutorService() {
        return Executors.newSingleThreadExecutor(
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("ExecutionReportWorker-" + thread.getId());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
