package com.eventbacktest.backtester.domain.event;

public enum OrderDirection {
    BUY,
    SELL;

    /**
     * +1 for BUY, -1 for SELL.
     */
    public int sign() {
        return this == BUY ? 1 : -1;
    }
}
