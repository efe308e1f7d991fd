package com.supergrid.trader.domain;

/**
 * Position effect attached to an order. Grid buys open, grid sells close.
 */
public enum Offset {
    NONE,
    OPEN,
    CLOSE
}
