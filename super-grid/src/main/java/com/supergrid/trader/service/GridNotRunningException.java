package com.supergrid.trader.service;

public class GridNotRunningException extends RuntimeException {

    public GridNotRunningException() {
        super("No grid is running");
    }
}
