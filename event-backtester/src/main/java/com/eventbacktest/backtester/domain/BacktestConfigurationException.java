package com.eventbacktest.backtester.domain;

/**
 * Exception thrown when a backtest cannot be assembled: missing or unreadable
 * bar file, empty series, unknown strategy or invalid parameters.
 * Fatal; raised before the event loop starts.
 */
public class BacktestConfigurationException extends RuntimeException {

    public BacktestConfigurationException(String message) {
        super(message);
    }

    public BacktestConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
