package com.eventbacktest.backtester.domain.event;

/**
 * Base type for all events. Implementations are immutable once created.
 */
public interface Event {

    /**
     * Get the tag used to route this event to a role.
     */
    EventType getType();
}
