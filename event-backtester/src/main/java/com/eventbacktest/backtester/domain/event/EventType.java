package com.eventbacktest.backtester.domain.event;

/**
 * Tag of every event travelling through the event queue.
 * The orchestrator dispatches on this tag.
 */
public enum EventType {
    MARKET,
    SIGNAL,
    ORDER,
    FILL
}
