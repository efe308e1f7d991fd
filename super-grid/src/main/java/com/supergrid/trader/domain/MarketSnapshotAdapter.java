package com.supergrid.trader.domain;

import java.math.BigDecimal;

/**
 * Converts ticks and bar closes into the common {@link MarketSnapshot} shape.
 */
public final class MarketSnapshotAdapter {

    private MarketSnapshotAdapter() {
    }

    /**
     * A tick with an empty side of the book falls back to its last price.
     */
    public static MarketSnapshot fromTick(TickData tick) {
        BigDecimal last = tick.getLastPrice();
        return MarketSnapshot.builder()
                .lastPrice(last)
                .bidPrice(tick.getBidPrice1() != null ? tick.getBidPrice1() : last)
                .askPrice(tick.getAskPrice1() != null ? tick.getAskPrice1() : last)
                .build();
    }

    /**
     * Bars carry no book, so bid and ask both collapse onto the close.
     */
    public static MarketSnapshot fromBar(BarData bar) {
        return MarketSnapshot.builder()
                .lastPrice(bar.getClose())
                .bidPrice(bar.getClose())
                .askPrice(bar.getClose())
                .build();
    }
}
