package com.supergrid.trader.infrastructure;

/**
 * Source of execution reports from the external executor.
 */
public interface ExecutionReportQueue {

    /**
     * Pop the next report, waiting briefly.
     *
     * @return the report, or null if none arrived before the timeout
     */
    ExecutionReport pop();
}
