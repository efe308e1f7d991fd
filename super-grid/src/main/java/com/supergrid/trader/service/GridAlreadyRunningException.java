package com.supergrid.trader.service;

public class GridAlreadyRunningException extends RuntimeException {

    public GridAlreadyRunningException(String symbol) {
        super("A grid is already running for " + symbol);
    }
}
