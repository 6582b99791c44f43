package com.eventbacktest.backtester.domain.portfolio;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One row of the finalized equity curve.
 */
@Value
@Builder
public class EquityCurvePoint {

    LocalDateTime timestamp;
    BigDecimal total;
    BigDecimal cash;
    BigDecimal commission;

    /**
     * Percentage change of total equity from the previous row, zero on the first row.
     */
    BigDecimal returns;

    /**
     * Cumulative return multiple, 1.0 at the start of the run.
     */
    BigDecimal equityCurve;

    /**
     * Decline from the running peak as a fraction of that peak.
     */
    BigDecimal drawdown;
}
