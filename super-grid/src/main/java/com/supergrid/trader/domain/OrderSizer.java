package com.supergrid.trader.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes the price and volume of grid orders from the config and the
 * current state. Pure: reads the state, never writes it.
 */
public final class OrderSizer {

    private OrderSizer() {
    }

    /**
     * Size a sell released from the upside.
     * Callers must only ask when the trigger price is positive.
     */
    public static SizedOrder sizeSell(GridConfig config, GridState state,
                                      BigDecimal lastPrice, BigDecimal bidPrice) {
        BigDecimal trigger = state.getTriggerPrice();

        BigDecimal price = bidPrice;
        if (config.getOrderType() == OrderType.LIMIT) {
            price = lastPrice.subtract(config.getSellOffset());
        }

        BigDecimal volume = baseVolume(config, price);

        BigDecimal risePct = PriceMath.percentOf(lastPrice.subtract(trigger), trigger);
        BigDecimal multiple = BigDecimal.ONE;
        if (config.isMultipleOrder()) {
            multiple = thresholdMultiple(risePct, config.getRisePercent(), RoundingMode.FLOOR);
            volume = volume.multiply(multiple);
        }

        BigDecimal minPosition = config.getMinPosition();
        if (minPosition.signum() > 0) {
            BigDecimal position = state.getPosition();
            volume = position.compareTo(minPosition) > 0
                    ? volume.min(position.subtract(minPosition))
                    : BigDecimal.ZERO;
        }

        return SizedOrder.builder()
                .price(price)
                .volume(volume)
                .multiple(multiple)
                .bias(risePct)
                .suppressed(isBiasSuppressed(config, risePct))
                .build();
    }

    /**
     * Size a buy released from the downside. Mirror of {@link #sizeSell}.
     */
    public static SizedOrder sizeBuy(GridConfig config, GridState state,
                                     BigDecimal lastPrice, BigDecimal askPrice) {
        BigDecimal trigger = state.getTriggerPrice();

        BigDecimal price = askPrice;
        if (config.getOrderType() == OrderType.LIMIT) {
            price = lastPrice.add(config.getBuyOffset());
        }

        BigDecimal volume = baseVolume(config, price);

        BigDecimal fallPct = PriceMath.percentOf(trigger.subtract(lastPrice), trigger);
        BigDecimal multiple = BigDecimal.ONE;
        if (config.isMultipleOrder()) {
            multiple = thresholdMultiple(fallPct, config.getFallPercent(), RoundingMode.CEILING);
            volume = volume.multiply(multiple);
        }

        BigDecimal maxPosition = config.getMaxPosition();
        if (maxPosition.signum() > 0) {
            // never negative: a position already above the cap buys nothing
            volume = volume.min(maxPosition.subtract(state.getPosition())).max(BigDecimal.ZERO);
        }

        return SizedOrder.builder()
                .price(price)
                .volume(volume)
                .multiple(multiple)
                .bias(fallPct)
                .suppressed(isBiasSuppressed(config, fallPct))
                .build();
    }

    /**
     * Fixed volume, or the notional rule {@code price / order_amount} when an
     * amount is configured. The notional formula is kept as the strategy
     * defines it.
     */
    private static BigDecimal baseVolume(GridConfig config, BigDecimal price) {
        BigDecimal amount = config.getOrderAmount();
        if (amount.signum() > 0) {
            return price.divide(amount, PriceMath.VOLUME_SCALE, RoundingMode.HALF_UP);
        }
        return config.getOrderVolume();
    }

    /**
     * How many thresholds the move spans, rounded the given way and never
     * below one. A zero threshold counts as a single multiple.
     */
    static BigDecimal thresholdMultiple(BigDecimal movePct, BigDecimal threshold, RoundingMode rounding) {
        if (threshold.signum() <= 0) {
            return BigDecimal.ONE;
        }
        BigDecimal multiple = movePct.divide(threshold, 0, rounding);
        return multiple.compareTo(BigDecimal.ONE) < 0 ? BigDecimal.ONE : multiple;
    }

    /**
     * With a give-up bias configured, trade only while {@code 0 < bias < give_up_bias}.
     */
    static boolean isBiasSuppressed(GridConfig config, BigDecimal bias) {
        BigDecimal giveUpBias = config.getGiveUpBias();
        if (giveUpBias.signum() <= 0) {
            return false;
        }
        return !(bias.signum() > 0 && bias.compareTo(giveUpBias) < 0);
    }
}
