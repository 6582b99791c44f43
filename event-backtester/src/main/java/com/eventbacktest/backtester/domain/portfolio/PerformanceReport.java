package com.eventbacktest.backtester.domain.portfolio;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Finalized equity curve and summary statistics of a run.
 */
@Value
@Builder
public class PerformanceReport {

    List<EquityCurvePoint> equityCurve;

    /**
     * Total return in percent.
     */
    BigDecimal totalReturn;

    BigDecimal sharpeRatio;

    /**
     * Maximum drawdown in percent of the running peak.
     */
    BigDecimal maxDrawdown;

    /**
     * Longest number of periods spent below a previous high-water mark.
     */
    int drawdownDuration;

    BigDecimal finalEquity;
}
