package com.supergrid.trader.service;

import com.supergrid.trader.domain.Direction;
import com.supergrid.trader.domain.GridStateSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Service for tracking grid activity metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class GridMetricsService {

    private final Counter evaluationsCounter;
    private final Counter buyIntentsCounter;
    private final Counter sellIntentsCounter;
    private final Counter fillsCounter;
    private final Counter sleepEnteredCounter;

    private final AtomicReference<Double> position = new AtomicReference<>(0.0);
    private final AtomicReference<Double> triggerPrice = new AtomicReference<>(0.0);

    public GridMetricsService(MeterRegistry meterRegistry) {
        this.evaluationsCounter = Counter.builder("grid.evaluations")
                .description("Total number of price snapshots evaluated")
                .register(meterRegistry);

        this.buyIntentsCounter = Counter.builder("grid.intents.sent")
                .description("Total number of grid orders sent to the gateway")
                .tag("direction", "long")
                .register(meterRegistry);

        this.sellIntentsCounter = Counter.builder("grid.intents.sent")
                .description("Total number of grid orders sent to the gateway")
                .tag("direction", "short")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("grid.fills")
                .description("Total number of executions applied to the grid")
                .register(meterRegistry);

        this.sleepEnteredCounter = Counter.builder("grid.sleep.entered")
                .description("Number of times price left the corridor and the grid went to sleep")
                .register(meterRegistry);

        Gauge.builder("grid.position", position, AtomicReference::get)
                .description("Current grid position")
                .register(meterRegistry);

        Gauge.builder("grid.trigger.price", triggerPrice, AtomicReference::get)
                .description("Current grid trigger price")
                .register(meterRegistry);

        log.info("GridMetricsService initialized with Micrometer metrics");
    }

    public void recordEvaluation() {
        evaluationsCounter.increment();
    }

    public void recordIntentSent(Direction direction) {
        if (direction == Direction.LONG) {
            buyIntentsCounter.increment();
        } else {
            sellIntentsCounter.increment();
        }
    }

    public void recordFill() {
        fillsCounter.increment();
    }

    public void recordSleepEntered() {
        sleepEnteredCounter.increment();
    }

    /**
     * Mirror the latest state into the gauges.
     */
    public void updateState(GridStateSnapshot snapshot) {
        if (snapshot.getPosition() != null) {
            position.set(snapshot.getPosition().doubleValue());
        }
        if (snapshot.getTriggerPrice() != null) {
            triggerPrice.set(snapshot.getTriggerPrice().doubleValue());
        }
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Evaluations=%d, Buys=%d, Sells=%d, Fills=%d, Sleeps=%d",
                (long) evaluationsCounter.count(),
                (long) buyIntentsCounter.count(),
                (long) sellIntentsCounter.count(),
                (long) fillsCounter.count(),
                (long) sleepEnteredCounter.count());
    }
}
