package com.eventbacktest.backtester.domain.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * An order the portfolio wants executed.
 */
@Value
@Builder
public class OrderEvent implements Event {

    @NonNull
    String symbol;

    @NonNull
    @Builder.Default
    OrderType orderType = OrderType.MARKET;

    long quantity;

    @NonNull
    OrderDirection direction;

    @Override
    public EventType getType() {
        return EventType.ORDER;
    }
}
