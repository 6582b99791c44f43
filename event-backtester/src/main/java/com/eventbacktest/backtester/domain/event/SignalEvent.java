package com.eventbacktest.backtester.domain.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A strategy's directional opinion on a symbol.
 * Strength is a relative sizing weight applied by the portfolio.
 */
@Value
@Builder
public class SignalEvent implements Event {

    @NonNull
    String strategyId;

    @NonNull
    String symbol;

    LocalDateTime timestamp;

    @NonNull
    SignalDirection direction;

    @Builder.Default
    double strength = 1.0;

    @Override
    public EventType getType() {
        return EventType.SIGNAL;
    }
}
