package com.eventbacktest.backtester.domain;

public class BacktestRunNotFoundException extends RuntimeException {

    private final Long runId;

    public BacktestRunNotFoundException(Long runId) {
        super("Backtest run not found: " + runId);
        this.runId = runId;
    }

    public Long getRunId() {
        return runId;
    }
}
