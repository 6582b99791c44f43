package com.eventbacktest.backtester.domain.execution;

/**
 * Order states reported by a broker session.
 */
public enum BrokerOrderStatus {
    PRE_SUBMITTED,
    SUBMITTED,
    FILLED,
    CANCELLED,
    INACTIVE
}
