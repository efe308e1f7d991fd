package com.supergrid.trader.domain;

import com.supergrid.trader.infrastructure.PaperOrderGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GridTrader running against the paper gateway.
 */
class GridTraderTest {

    private static final String SYMBOL = "BTCUSDT.BINANCE";

    private PaperOrderGateway gateway;
    private GridStateListener listener;

    @BeforeEach
    void setUp() {
        gateway = new PaperOrderGateway();
        listener = mock(GridStateListener.class);
    }

    @Test
    void testConstructor_RejectsInvalidConfig() {
        GridConfig config = GridConfig.builder().triggerPrice(new BigDecimal("70000")).build();

        assertThrows(GridConfigurationException.class, () -> new GridTrader(config, gateway, listener));
    }

    @Test
    void testOnTick_IgnoredUntilStarted() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().build(), gateway, listener);

        // Act
        List<OrderIntent> sent = trader.onTick(tick("48000"));

        // Assert
        assertTrue(sent.isEmpty());
        assertTrue(gateway.getRestingOrders().isEmpty());
    }

    @Test
    void testOnTick_SendsOrderAndTracksPending() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().multipleOrder(false).build(), gateway, listener);
        trader.start();

        // Act
        List<OrderIntent> sent = trader.onTick(tick("47470"));

        // Assert
        assertEquals(1, sent.size());
        assertEquals("PAPER-1", trader.getSnapshot().getPendingOrderId());
        assertEquals(1, gateway.getRestingOrders().size());
    }

    @Test
    void testOnTick_PaperFillUpdatesPositionAndTrigger() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().multipleOrder(false).build(), gateway, listener);
        trader.start();
        trader.onTick(tick("47470"));

        // Act
        List<OrderIntent> sent = trader.onTick(tick("47480"));

        // Assert
        assertTrue(sent.isEmpty());
        GridStateSnapshot snapshot = trader.getSnapshot();
        assertEquals(0, new BigDecimal("-0.1").compareTo(snapshot.getPosition()));
        assertEquals(0, new BigDecimal("47470").compareTo(snapshot.getTriggerPrice()));
        assertNull(snapshot.getPendingOrderId(), "Filled order should free the pending slot");
        assertTrue(gateway.getRestingOrders().isEmpty(), "Filled order should leave the book");
        verify(listener).onFillApplied(eq(SYMBOL), any(Fill.class));
    }

    @Test
    void testOnTick_BothSidesInOneCycleTrackLastOrder() {
        // Arrange
        GridTrader trader = new GridTrader(
                GridConfig.builder().riseUp(new BigDecimal("0.5")).build(), gateway, listener);
        trader.start();
        trader.onTick(tick("46500"));

        // Act
        List<OrderIntent> sent = trader.onTick(tick("47500"));

        // Assert
        assertEquals(2, sent.size());
        assertEquals("PAPER-2", trader.getSnapshot().getPendingOrderId(), "The buy is sent last and tracked");

        // Act
        trader.onOrderUpdate(OrderUpdate.builder().orderId("PAPER-1").active(false).status("FILLED").build());

        // Assert
        assertEquals("PAPER-2", trader.getSnapshot().getPendingOrderId(),
                "Finishing the untracked sell leaves the buy pending");
    }

    @Test
    void testOnBar_DrivesBacktestGrid() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().build(), gateway, listener);
        trader.start();

        // Act
        List<OrderIntent> sent = trader.onBar(BarData.builder().close(new BigDecimal("46000")).build());

        // Assert
        assertEquals(1, sent.size());
        assertEquals(Direction.LONG, sent.get(0).getDirection());
    }

    @Test
    void testOnBar_IgnoredOnLiveGateway() {
        // Arrange
        OrderGateway live = mock(OrderGateway.class);
        when(live.mode()).thenReturn(GatewayMode.LIVE);
        GridTrader trader = new GridTrader(GridConfig.builder().build(), live, listener);
        trader.start();

        // Act
        List<OrderIntent> sent = trader.onBar(BarData.builder().close(new BigDecimal("46000")).build());

        // Assert
        assertTrue(sent.isEmpty());
        verify(live, never()).sendOrder(any());
    }

    @Test
    void testOnTick_GatewayRejectionLeavesNoPendingOrder() {
        // Arrange
        OrderGateway failing = mock(OrderGateway.class);
        when(failing.mode()).thenReturn(GatewayMode.LIVE);
        when(failing.sendOrder(any())).thenThrow(new RuntimeException("Redis down"));
        GridTrader trader = new GridTrader(GridConfig.builder().build(), failing, listener);
        trader.start();

        // Act
        List<OrderIntent> sent = trader.onTick(tick("46000"));

        // Assert
        assertTrue(sent.isEmpty());
        assertNull(trader.getSnapshot().getPendingOrderId());
    }

    @Test
    void testStop_CancelsRestingOrders() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().build(), gateway, listener);
        trader.start();
        trader.onTick(tick("46000"));

        // Act
        trader.stop();

        // Assert
        assertFalse(trader.isActive());
        assertTrue(gateway.getRestingOrders().isEmpty());
    }

    @Test
    void testOnPosition_OverwritesPosition() {
        // Arrange
        GridTrader trader = new GridTrader(GridConfig.builder().build(), gateway, listener);

        // Act
        trader.onPosition(PositionSync.builder().volume(new BigDecimal("2")).build());

        // Assert
        assertEquals(0, new BigDecimal("2").compareTo(trader.getSnapshot().getPosition()));
    }

    private static TickData tick(String last) {
        return TickData.builder()
                .symbol(SYMBOL)
                .datetime(LocalDateTime.now())
                .lastPrice(new BigDecimal(last))
                .build();
    }
}
