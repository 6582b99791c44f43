package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.BacktestConfigurationException;

import java.util.Locale;

/**
 * How a run turns orders into fills.
 */
public enum ExecutionMode {
    /** Synchronous fills at the latest close. */
    SIMULATED,
    /** Broker-backed execution against the in-process paper session. */
    PAPER_BROKER;

    /**
     * Resolve a configured mode name, ignoring case and accepting '-' for '_'.
     *
     * @throws BacktestConfigurationException for an unknown name
     */
    public static ExecutionMode fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new BacktestConfigurationException("Execution mode must not be blank");
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ExecutionMode mode : values()) {
            if (mode.name().equals(normalized)) {
                return mode;
            }
        }
        throw new BacktestConfigurationException("Unknown execution mode: " + name);
    }
}
