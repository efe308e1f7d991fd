package com.supergrid.trader.domain;

/**
 * Thrown when a grid configuration is rejected at construction time.
 */
public class GridConfigurationException extends IllegalArgumentException {

    public GridConfigurationException(String message) {
        super(message);
    }
}
