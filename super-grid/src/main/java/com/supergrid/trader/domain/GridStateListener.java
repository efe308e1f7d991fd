package com.supergrid.trader.domain;

/**
 * Observability sink for grid state. Receives a snapshot after every
 * evaluation and every ledger update; nothing in the grid reads it back.
 */
public interface GridStateListener {

    /**
     * Called with the state as it stands after the event.
     *
     * @param symbol   the traded instrument
     * @param snapshot immutable copy of the grid state
     */
    void onStateChanged(String symbol, GridStateSnapshot snapshot);

    /**
     * Called once per execution, before the state snapshot that reflects it.
     */
    default void onFillApplied(String symbol, Fill fill) {
    }
}
