package com.eventbacktest.backtester.domain.event;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Signals that a new synchronized timestep is available from the bar source.
 * Carries no payload.
 */
@ToString
@EqualsAndHashCode
public final class MarketEvent implements Event {

    @Override
    public EventType getType() {
        return EventType.MARKET;
    }
}
