package com.supergrid.trader.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable parameters of a single grid.
 * Defaults mirror the stock grid settings: a 40000-60000 corridor around
 * 47000 with 1% arming thresholds and 0.1 lots per order.
 */
@Value
@Builder(toBuilder = true)
public class GridConfig {

    @Builder.Default
    String vtSymbol = "BTCUSDT.BINANCE";

    @Builder.Default
    BigDecimal lowerPrice = new BigDecimal("40000");

    @Builder.Default
    BigDecimal upperPrice = new BigDecimal("60000");

    @Builder.Default
    BigDecimal triggerPrice = new BigDecimal("47000");

    /** Rise above the trigger, in percent, that arms the sell side. */
    @Builder.Default
    BigDecimal risePercent = new BigDecimal("1.0");

    /** Retrace from the recorded high, in percent, that releases a sell. */
    @Builder.Default
    BigDecimal fallDown = BigDecimal.ZERO;

    /** Fall below the trigger, in percent, that arms the buy side. */
    @Builder.Default
    BigDecimal fallPercent = new BigDecimal("1.0");

    /** Rebound from the recorded low, in percent, that releases a buy. */
    @Builder.Default
    BigDecimal riseUp = BigDecimal.ZERO;

    @Builder.Default
    OrderType orderType = OrderType.LIMIT;

    @Builder.Default
    BigDecimal orderVolume = new BigDecimal("0.1");

    /** Notional sizing; zero disables it. */
    @Builder.Default
    BigDecimal orderAmount = BigDecimal.ZERO;

    /** Buy-side position cap; zero disables it. */
    @Builder.Default
    BigDecimal maxPosition = BigDecimal.ZERO;

    /** Sell-side position floor; zero disables it. */
    @Builder.Default
    BigDecimal minPosition = BigDecimal.ZERO;

    @Builder.Default
    boolean multipleOrder = true;

    @Builder.Default
    Deadline deadline = Deadline.FIVE_DAYS;

    /** Largest tolerated move from the trigger, in percent; zero disables it. */
    @Builder.Default
    BigDecimal giveUpBias = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal buyOffset = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal sellOffset = BigDecimal.ZERO;

    /**
     * Reject inconsistent settings. Nothing is clamped.
     *
     * @throws GridConfigurationException on the first violated rule
     */
    public void validate() {
        if (vtSymbol == null || vtSymbol.isBlank()) {
            throw new GridConfigurationException("vt_symbol is required");
        }
        requirePresent("lower_price", lowerPrice);
        requirePresent("upper_price", upperPrice);
        requirePresent("trigger_price", triggerPrice);
        if (orderType == null) {
            throw new GridConfigurationException("order_type is required");
        }

        if (lowerPrice.compareTo(upperPrice) > 0) {
            throw new GridConfigurationException(
                    "lower_price " + lowerPrice + " is above upper_price " + upperPrice);
        }
        if (triggerPrice.compareTo(lowerPrice) < 0 || triggerPrice.compareTo(upperPrice) > 0) {
            throw new GridConfigurationException(
                    "trigger_price " + triggerPrice + " lies outside [" + lowerPrice + ", " + upperPrice + "]");
        }

        requireNonNegative("rise_percent", risePercent);
        requireNonNegative("fall_percent", fallPercent);
        requireNonNegative("fall_down", fallDown);
        requireNonNegative("rise_up", riseUp);
        requireNonNegative("give_up_bias", giveUpBias);
        requireNonNegative("order_volume", orderVolume);
        requireNonNegative("order_amount", orderAmount);
        requireNonNegative("max_position", maxPosition);
        requireNonNegative("min_position", minPosition);
        requirePresent("buy_offset", buyOffset);
        requirePresent("sell_offset", sellOffset);
    }

    private static void requirePresent(String name, BigDecimal value) {
        if (value == null) {
            throw new GridConfigurationException(name + " is required");
        }
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        requirePresent(name, value);
        if (value.signum() < 0) {
            throw new GridConfigurationException(name + " must not be negative, got " + value);
        }
    }
}
