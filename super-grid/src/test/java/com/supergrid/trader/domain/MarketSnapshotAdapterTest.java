package com.supergrid.trader.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MarketSnapshotAdapter.
 */
class MarketSnapshotAdapterTest {

    @Test
    void testFromTick_KeepsBook() {
        TickData tick = TickData.builder()
                .symbol("BTCUSDT.BINANCE")
                .datetime(LocalDateTime.now())
                .lastPrice(new BigDecimal("47000"))
                .bidPrice1(new BigDecimal("46995"))
                .askPrice1(new BigDecimal("47005"))
                .build();

        MarketSnapshot snapshot = MarketSnapshotAdapter.fromTick(tick);

        assertEquals(new BigDecimal("47000"), snapshot.getLastPrice());
        assertEquals(new BigDecimal("46995"), snapshot.getBidPrice());
        assertEquals(new BigDecimal("47005"), snapshot.getAskPrice());
    }

    @Test
    void testFromTick_EmptyBookFallsBackToLast() {
        TickData tick = TickData.builder().lastPrice(new BigDecimal("47000")).build();

        MarketSnapshot snapshot = MarketSnapshotAdapter.fromTick(tick);

        assertEquals(new BigDecimal("47000"), snapshot.getBidPrice());
        assertEquals(new BigDecimal("47000"), snapshot.getAskPrice());
    }

    @Test
    void testFromBar_CollapsesOnClose() {
        BarData bar = BarData.builder()
                .open(new BigDecimal("46000"))
                .high(new BigDecimal("48000"))
                .low(new BigDecimal("45500"))
                .close(new BigDecimal("47200"))
                .volume(12L)
                .build();

        MarketSnapshot snapshot = MarketSnapshotAdapter.fromBar(bar);

        assertEquals(new BigDecimal("47200"), snapshot.getLastPrice());
        assertEquals(new BigDecimal("47200"), snapshot.getBidPrice());
        assertEquals(new BigDecimal("47200"), snapshot.getAskPrice());
    }
}
