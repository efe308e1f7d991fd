package com.supergrid.trader.service;

import com.supergrid.trader.domain.Direction;
import com.supergrid.trader.domain.GridStateSnapshot;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GridMetricsService.
 */
class GridMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private GridMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metricsService = new GridMetricsService(registry);
    }

    @Test
    void testRecordIntentSent_TaggedByDirection() {
        // Act
        metricsService.recordIntentSent(Direction.LONG);
        metricsService.recordIntentSent(Direction.LONG);
        metricsService.recordIntentSent(Direction.SHORT);

        // Assert
        assertEquals(2.0, registry.get("grid.intents.sent").tag("direction", "long").counter().count());
        assertEquals(1.0, registry.get("grid.intents.sent").tag("direction", "short").counter().count());
    }

    @Test
    void testUpdateState_MirrorsGauges() {
        // Act
        metricsService.updateState(GridStateSnapshot.builder()
                .position(new BigDecimal("0.3"))
                .triggerPrice(new BigDecimal("46000"))
                .build());

        // Assert
        assertEquals(0.3, registry.get("grid.position").gauge().value(), 1e-9);
        assertEquals(46000.0, registry.get("grid.trigger.price").gauge().value(), 1e-9);
    }

    @Test
    void testGetMetricsSummary() {
        // Arrange
        metricsService.recordEvaluation();
        metricsService.recordFill();
        metricsService.recordSleepEntered();

        // Act
        String summary = metricsService.getMetricsSummary();

        // Assert
        assertTrue(summary.contains("Evaluations=1"));
        assertTrue(summary.contains("Fills=1"));
        assertTrue(summary.contains("Sleeps=1"));
    }
}
