package com.supergrid.trader.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for OrderSizer.
 */
class OrderSizerTest {

    @Test
    void testSizeSell_LimitPriceUsesSellOffset() {
        // Arrange
        GridConfig config = GridConfig.builder()
                .sellOffset(new BigDecimal("5"))
                .multipleOrder(false)
                .build();

        // Act
        SizedOrder sell = OrderSizer.sizeSell(config, state("0"), new BigDecimal("47500"), new BigDecimal("47490"));

        // Assert
        assertEquals(0, new BigDecimal("47495").compareTo(sell.getPrice()));
        assertEquals(0, new BigDecimal("0.1").compareTo(sell.getVolume()));
        assertTrue(sell.isExecutable());
    }

    @Test
    void testSizeBuy_MarketPriceUsesAsk() {
        // Arrange
        GridConfig config = GridConfig.builder()
                .orderType(OrderType.MARKET)
                .buyOffset(new BigDecimal("5"))
                .build();

        // Act
        SizedOrder buy = OrderSizer.sizeBuy(config, state("0"), new BigDecimal("46500"), new BigDecimal("46510"));

        // Assert
        assertEquals(0, new BigDecimal("46510").compareTo(buy.getPrice()), "Offsets apply to limit orders only");
    }

    @Test
    void testSizeSell_NotionalSizingDividesPriceByAmount() {
        // Arrange
        GridConfig config = GridConfig.builder()
                .orderAmount(new BigDecimal("1000"))
                .multipleOrder(false)
                .build();

        // Act
        SizedOrder sell = OrderSizer.sizeSell(config, state("0"), new BigDecimal("47500"), new BigDecimal("47500"));

        // Assert
        assertEquals(0, new BigDecimal("47.5").compareTo(sell.getVolume()));
    }

    @Test
    void testSizeSell_MinPositionClampsVolume() {
        // Arrange
        GridConfig config = GridConfig.builder()
                .minPosition(new BigDecimal("0.5"))
                .multipleOrder(false)
                .build();

        // Act
        SizedOrder partial = OrderSizer.sizeSell(config, state("0.55"), new BigDecimal("47500"), new BigDecimal("47500"));
        SizedOrder none = OrderSizer.sizeSell(config, state("0.4"), new BigDecimal("47500"), new BigDecimal("47500"));

        // Assert
        assertEquals(0, new BigDecimal("0.05").compareTo(partial.getVolume()));
        assertEquals(0, BigDecimal.ZERO.compareTo(none.getVolume()), "At or below the floor nothing is sold");
        assertFalse(none.hasVolume());
        assertTrue(none.isExecutable(), "A clamped release still goes ahead");
    }

    @Test
    void testSizeBuy_MaxPositionClampsVolume() {
        // Arrange
        GridConfig config = GridConfig.builder()
                .maxPosition(new BigDecimal("1"))
                .multipleOrder(false)
                .build();

        // Act
        SizedOrder partial = OrderSizer.sizeBuy(config, state("0.95"), new BigDecimal("46500"), new BigDecimal("46500"));
        SizedOrder none = OrderSizer.sizeBuy(config, state("1.2"), new BigDecimal("46500"), new BigDecimal("46500"));

        // Assert
        assertEquals(0, new BigDecimal("0.05").compareTo(partial.getVolume()));
        assertEquals(0, BigDecimal.ZERO.compareTo(none.getVolume()), "Above the cap the volume is zero, not negative");
        assertFalse(none.hasVolume());
        assertTrue(none.isExecutable(), "A clamped release still goes ahead");
    }

    @Test
    void testSizeBuy_ReportsBiasAsFallPercent() {
        // Arrange
        GridConfig config = GridConfig.builder().build();

        // Act
        SizedOrder buy = OrderSizer.sizeBuy(config, state("0"), new BigDecimal("46060"), new BigDecimal("46060"));

        // Assert
        assertEquals(0, new BigDecimal("2").compareTo(buy.getBias()), "940 under 47000 is a 2% fall");
        assertEquals(0, new BigDecimal("2").compareTo(buy.getMultiple()));
    }

    @Test
    void testThresholdMultiple_RoundingAndFloor() {
        assertEquals(0, BigDecimal.valueOf(2).compareTo(
                OrderSizer.thresholdMultiple(new BigDecimal("2.9"), BigDecimal.ONE, RoundingMode.FLOOR)));
        assertEquals(0, BigDecimal.valueOf(3).compareTo(
                OrderSizer.thresholdMultiple(new BigDecimal("2.1"), BigDecimal.ONE, RoundingMode.CEILING)));
        assertEquals(0, BigDecimal.ONE.compareTo(
                OrderSizer.thresholdMultiple(new BigDecimal("0.3"), BigDecimal.ONE, RoundingMode.FLOOR)),
                "Multiple never drops below one");
        assertEquals(0, BigDecimal.ONE.compareTo(
                OrderSizer.thresholdMultiple(new BigDecimal("5"), BigDecimal.ZERO, RoundingMode.FLOOR)),
                "Zero threshold counts as a single multiple");
    }

    @Test
    void testIsBiasSuppressed_Window() {
        GridConfig disabled = GridConfig.builder().build();
        GridConfig enabled = GridConfig.builder().giveUpBias(new BigDecimal("2")).build();

        assertFalse(OrderSizer.isBiasSuppressed(disabled, new BigDecimal("50")));
        assertFalse(OrderSizer.isBiasSuppressed(enabled, new BigDecimal("1.5")));
        assertTrue(OrderSizer.isBiasSuppressed(enabled, new BigDecimal("2")), "Upper edge is excluded");
        assertTrue(OrderSizer.isBiasSuppressed(enabled, BigDecimal.ZERO), "Zero bias is excluded");
    }

    private static GridState state(String position) {
        return GridState.builder()
                .triggerPrice(new BigDecimal("47000"))
                .position(new BigDecimal(position))
                .build();
    }
}
