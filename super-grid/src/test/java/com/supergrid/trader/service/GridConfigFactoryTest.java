package com.supergrid.trader.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.supergrid.trader.domain.Deadline;
import com.supergrid.trader.domain.GridConfig;
import com.supergrid.trader.domain.GridConfigurationException;
import com.supergrid.trader.domain.OrderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GridConfigFactory.
 */
class GridConfigFactoryTest {

    private GridConfigFactory factory;

    @BeforeEach
    void setUp() {
        factory = new GridConfigFactory(new ObjectMapper());
    }

    @Test
    void testCreateConfig_EmptySettingsUseDefaults() {
        // Act
        GridConfig config = factory.createConfig(Map.of());

        // Assert
        assertEquals(GridConfig.builder().build(), config);
    }

    @Test
    void testCreateConfig_ParsesAllOptionKinds() {
        // Arrange
        Map<String, Object> settings = new HashMap<>();
        settings.put("vt_symbol", "ETHUSDT.BINANCE");
        settings.put("lower_price", 2000);
        settings.put("upper_price", "4000");
        settings.put("trigger_price", 3000.5);
        settings.put("rise_percent", "2");
        settings.put("order_type", "market");
        settings.put("multiple_order", "false");
        settings.put("deadline", "GTC");
        settings.put("give_up_bias", 5);

        // Act
        GridConfig config = factory.createConfig(settings);

        // Assert
        assertEquals("ETHUSDT.BINANCE", config.getVtSymbol());
        assertEquals(0, new BigDecimal("2000").compareTo(config.getLowerPrice()));
        assertEquals(0, new BigDecimal("4000").compareTo(config.getUpperPrice()));
        assertEquals(0, new BigDecimal("3000.5").compareTo(config.getTriggerPrice()));
        assertEquals(0, new BigDecimal("2").compareTo(config.getRisePercent()));
        assertEquals(OrderType.MARKET, config.getOrderType());
        assertFalse(config.isMultipleOrder());
        assertEquals(Deadline.GOOD_TILL_CANCELLED, config.getDeadline());
        assertEquals(0, new BigDecimal("5").compareTo(config.getGiveUpBias()));
        assertEquals(0, new BigDecimal("0.1").compareTo(config.getOrderVolume()), "Unset options keep defaults");
    }

    @Test
    void testCreateConfig_UnknownOptionIgnored() {
        assertDoesNotThrow(() -> factory.createConfig(Map.of("class_name", "SuperGridAlgo")));
    }

    @Test
    void testCreateConfig_MalformedNumberRejected() {
        GridConfigurationException ex = assertThrows(GridConfigurationException.class,
                () -> factory.createConfig(Map.of("rise_percent", "one")));
        assertTrue(ex.getMessage().contains("rise_percent"));
    }

    @Test
    void testCreateConfig_UnknownOrderTypeRejected() {
        assertThrows(GridConfigurationException.class,
                () -> factory.createConfig(Map.of("order_type", "STOP")));
    }

    @Test
    void testCreateConfig_InconsistentCorridorRejected() {
        assertThrows(GridConfigurationException.class,
                () -> factory.createConfig(Map.of("trigger_price", 65000)));
    }
}
