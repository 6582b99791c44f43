package com.eventbacktest.backtester.domain.portfolio;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Immutable mark-to-market state of the portfolio at one timestep.
 * Invariant: total = cash + sum of marketValues.
 */
@Value
@Builder
public class EquitySnapshot {

    LocalDateTime timestamp;
    BigDecimal cash;
    BigDecimal commission;
    Map<String, Long> positions;
    Map<String, BigDecimal> marketValues;
    BigDecimal total;
}
