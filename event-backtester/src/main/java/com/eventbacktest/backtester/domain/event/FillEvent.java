package com.eventbacktest.backtester.domain.event;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * The realized outcome of an order: quantity executed, unit price and commission.
 */
@Value
@Builder
public class FillEvent implements Event {

    LocalDateTime timestamp;

    @NonNull
    String symbol;

    String exchange;

    long quantity;

    @NonNull
    OrderDirection direction;

    /**
     * Price per unit.
     */
    @NonNull
    BigDecimal fillCost;

    @NonNull
    @Builder.Default
    BigDecimal commission = BigDecimal.ZERO;

    /**
     * Gross traded value, quantity times unit price.
     */
    public BigDecimal getGrossValue() {
        return fillCost.multiply(BigDecimal.valueOf(quantity));
    }

    @Override
    public EventType getType() {
        return EventType.FILL;
    }
}
