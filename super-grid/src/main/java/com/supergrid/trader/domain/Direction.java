package com.supergrid.trader.domain;

/**
 * Side of an order or fill. LONG buys, SHORT sells.
 */
public enum Direction {
    LONG,
    SHORT
}
