package com.supergrid.trader.domain;

/**
 * Capability of an order gateway, fixed when the gateway is built.
 */
public enum GatewayMode {
    /** Orders go to a real venue; executions arrive asynchronously. */
    LIVE,
    /** Orders are matched in-process against the replayed price stream. */
    BACKTEST
}
