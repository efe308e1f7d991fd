package com.supergrid.trader.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GridConfig validation.
 */
class GridConfigTest {

    @Test
    void testValidate_DefaultsAreValid() {
        assertDoesNotThrow(() -> GridConfig.builder().build().validate());
    }

    @Test
    void testValidate_TriggerOnCorridorEdgeIsValid() {
        GridConfig config = GridConfig.builder().triggerPrice(new BigDecimal("40000")).build();

        assertDoesNotThrow(config::validate);
    }

    @Test
    void testValidate_TriggerOutsideCorridor() {
        GridConfig config = GridConfig.builder().triggerPrice(new BigDecimal("39999")).build();

        GridConfigurationException ex = assertThrows(GridConfigurationException.class, config::validate);
        assertTrue(ex.getMessage().contains("trigger_price"));
    }

    @Test
    void testValidate_LowerAboveUpper() {
        GridConfig config = GridConfig.builder()
                .lowerPrice(new BigDecimal("60000"))
                .upperPrice(new BigDecimal("40000"))
                .build();

        assertThrows(GridConfigurationException.class, config::validate);
    }

    @Test
    void testValidate_NegativeThresholdsRejected() {
        assertThrows(GridConfigurationException.class,
                () -> GridConfig.builder().risePercent(new BigDecimal("-1")).build().validate());
        assertThrows(GridConfigurationException.class,
                () -> GridConfig.builder().fallDown(new BigDecimal("-0.1")).build().validate());
        assertThrows(GridConfigurationException.class,
                () -> GridConfig.builder().maxPosition(new BigDecimal("-2")).build().validate());
    }

    @Test
    void testValidate_BlankSymbolRejected() {
        GridConfig config = GridConfig.builder().vtSymbol(" ").build();

        assertThrows(GridConfigurationException.class, config::validate);
    }

    @Test
    void testDeadlineParse() {
        assertEquals(Deadline.FIVE_DAYS, Deadline.parse(null));
        assertEquals(Deadline.TWENTY_DAYS, Deadline.parse("20d"));
        assertEquals(Deadline.GOOD_TILL_CANCELLED, Deadline.parse("good_till_cancelled"));
        assertThrows(GridConfigurationException.class, () -> Deadline.parse("1Y"));
    }
}
