package com.supergrid.trader.domain;

/**
 * Executes grid order intents. The grid never talks to a venue directly;
 * everything goes through this seam.
 */
public interface OrderGateway {

    /**
     * Capability of this gateway, fixed at construction.
     */
    GatewayMode mode();

    /**
     * Submit an order.
     *
     * @param intent the order to place
     * @return opaque id used by later order updates and fills
     */
    String sendOrder(OrderIntent intent);

    /**
     * Fire-and-forget request to cancel every working order for the symbol.
     */
    void cancelAll(String symbol);

    /**
     * Give a simulated venue the chance to cross resting orders against the
     * latest snapshot, reporting executions to the listener. Live venues
     * report asynchronously and ignore this.
     */
    default void matchOrders(MarketSnapshot snapshot, GatewayEventListener listener) {
    }
}
