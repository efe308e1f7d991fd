package com.supergrid.trader.domain;

/**
 * Receives execution events from an {@link OrderGateway}.
 */
public interface GatewayEventListener {

    void onOrderUpdate(OrderUpdate update);

    void onFill(Fill fill);
}
