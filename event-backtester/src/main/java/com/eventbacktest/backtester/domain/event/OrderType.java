package com.eventbacktest.backtester.domain.event;

public enum OrderType {
    MARKET,
    LIMIT
}
