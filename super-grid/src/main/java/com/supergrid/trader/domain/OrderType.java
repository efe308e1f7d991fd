package com.supergrid.trader.domain;

/**
 * How an order is priced when it reaches the venue.
 */
public enum OrderType {
    LIMIT,
    MARKET
}
