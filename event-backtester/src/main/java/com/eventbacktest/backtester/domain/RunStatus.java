package com.eventbacktest.backtester.domain;

/**
 * Lifecycle status of a stored backtest run.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
