package com.eventbacktest.backtester.domain;

/**
 * Lifecycle of a single backtest run. DONE is terminal.
 */
public enum BacktestState {
    RUNNING,
    EXHAUSTED,
    DONE
}
