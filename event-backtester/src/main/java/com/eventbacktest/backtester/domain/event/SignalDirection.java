package com.eventbacktest.backtester.domain.event;

public enum SignalDirection {
    LONG,
    SHORT,
    EXIT
}
