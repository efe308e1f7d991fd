package com.supergrid.trader.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Price and volume computed for one side of the grid, together with the
 * outcome of the bias check.
 */
@Value
@Builder
public class SizedOrder {

    BigDecimal price;
    BigDecimal volume;

    /** Threshold multiple applied to the volume, 1 when multiple orders are off. */
    BigDecimal multiple;

    /** Move from the trigger price, in percent, measured toward this side. */
    BigDecimal bias;

    /** True when the give-up bias rule abandons the trade for this cycle. */
    boolean suppressed;

    /**
     * Whether the release goes ahead. Only the bias rule abandons a release;
     * a volume clamped to zero still disarms the side and moves the trigger.
     */
    public boolean isExecutable() {
        return !suppressed;
    }

    /**
     * Whether there is anything to send once the position clamps are applied.
     */
    public boolean hasVolume() {
        return volume.signum() > 0;
    }
}
