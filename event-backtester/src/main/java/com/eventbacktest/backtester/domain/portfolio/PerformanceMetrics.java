package com.eventbacktest.backtester.domain.portfolio;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Calculator for equity curve series and summary statistics.
 */
@Slf4j
public final class PerformanceMetrics {

    private static final int SERIES_SCALE = 8;
    private static final int STAT_SCALE = 4;

    private PerformanceMetrics() {
    }

    /**
     * Finalize an ordered list of equity snapshots into a report.
     */
    public static PerformanceReport buildReport(List<EquitySnapshot> snapshots, int periodsPerYear) {
        if (snapshots.isEmpty()) {
            return PerformanceReport.builder()
                    .equityCurve(Collections.emptyList())
                    .totalReturn(BigDecimal.ZERO)
                    .sharpeRatio(BigDecimal.ZERO)
                    .maxDrawdown(BigDecimal.ZERO)
                    .drawdownDuration(0)
                    .finalEquity(BigDecimal.ZERO)
                    .build();
        }

        List<BigDecimal> totals = new ArrayList<>(snapshots.size());
        snapshots.forEach(s -> totals.add(s.getTotal()));

        List<BigDecimal> returns = calculateReturns(totals);
        List<BigDecimal> curve = calculateEquityCurve(returns);
        List<BigDecimal> drawdowns = calculateDrawdowns(curve);

        List<EquityCurvePoint> points = new ArrayList<>(snapshots.size());
        for (int i = 0; i < snapshots.size(); i++) {
            EquitySnapshot snapshot = snapshots.get(i);
            points.add(EquityCurvePoint.builder()
                    .timestamp(snapshot.getTimestamp())
                    .total(snapshot.getTotal())
                    .cash(snapshot.getCash())
                    .commission(snapshot.getCommission())
                    .returns(returns.get(i))
                    .equityCurve(curve.get(i))
                    .drawdown(drawdowns.get(i))
                    .build());
        }

        BigDecimal totalReturn = curve.get(curve.size() - 1)
                .subtract(BigDecimal.ONE)
                .multiply(BigDecimal.valueOf(100))
                .setScale(STAT_SCALE, RoundingMode.HALF_UP);

        return PerformanceReport.builder()
                .equityCurve(Collections.unmodifiableList(points))
                .totalReturn(totalReturn)
                .sharpeRatio(calculateSharpeRatio(returns.subList(1, returns.size()), periodsPerYear))
                .maxDrawdown(calculateMaxDrawdown(drawdowns))
                .drawdownDuration(calculateDrawdownDuration(drawdowns))
                .finalEquity(totals.get(totals.size() - 1))
                .build();
    }

    /**
     * Percentage change between consecutive values. The first entry is zero.
     */
    public static List<BigDecimal> calculateReturns(List<BigDecimal> values) {
        List<BigDecimal> returns = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (i == 0) {
                returns.add(BigDecimal.ZERO);
                continue;
            }
            BigDecimal prevValue = values.get(i - 1);
            BigDecimal currentValue = values.get(i);

            if (prevValue.compareTo(BigDecimal.ZERO) == 0) {
                returns.add(BigDecimal.ZERO);
            } else {
                returns.add(currentValue.subtract(prevValue)
                        .divide(prevValue, SERIES_SCALE, RoundingMode.HALF_UP));
            }
        }
        return returns;
    }

    /**
     * Cumulative product of (1 + r).
     */
    public static List<BigDecimal> calculateEquityCurve(List<BigDecimal> returns) {
        List<BigDecimal> curve = new ArrayList<>(returns.size());
        BigDecimal level = BigDecimal.ONE;
        for (BigDecimal r : returns) {
            level = level.multiply(BigDecimal.ONE.add(r)).setScale(SERIES_SCALE, RoundingMode.HALF_UP);
            curve.add(level);
        }
        return curve;
    }

    /**
     * Running peak minus current value, as a fraction of the peak.
     */
    public static List<BigDecimal> calculateDrawdowns(List<BigDecimal> values) {
        List<BigDecimal> drawdowns = new ArrayList<>(values.size());
        BigDecimal peak = null;
        for (BigDecimal value : values) {
            if (peak == null || value.compareTo(peak) > 0) {
                peak = value;
            }
            if (peak.compareTo(BigDecimal.ZERO) > 0) {
                drawdowns.add(peak.subtract(value).divide(peak, SERIES_SCALE, RoundingMode.HALF_UP));
            } else {
                drawdowns.add(BigDecimal.ZERO);
            }
        }
        return drawdowns;
    }

    /**
     * Annualized Sharpe ratio with a zero risk-free rate.
     */
    public static BigDecimal calculateSharpeRatio(List<BigDecimal> returns, int periodsPerYear) {
        if (returns.size() < 2) {
            return BigDecimal.ZERO;
        }

        double mean = returns.stream().mapToDouble(BigDecimal::doubleValue).average().orElse(0.0);
        double variance = returns.stream()
                .mapToDouble(r -> Math.pow(r.doubleValue() - mean, 2))
                .sum() / returns.size();
        double stdDev = Math.sqrt(variance);

        if (stdDev < 1e-12) {
            return BigDecimal.ZERO;
        }

        double sharpe = Math.sqrt(periodsPerYear) * mean / stdDev;
        return BigDecimal.valueOf(sharpe).setScale(STAT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Largest drawdown, in percent.
     */
    public static BigDecimal calculateMaxDrawdown(List<BigDecimal> drawdowns) {
        BigDecimal max = drawdowns.stream().reduce(BigDecimal.ZERO, BigDecimal::max);
        return max.multiply(BigDecimal.valueOf(100)).setScale(STAT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Longest run of consecutive periods with a non-zero drawdown.
     */
    public static int calculateDrawdownDuration(List<BigDecimal> drawdowns) {
        int longest = 0;
        int current = 0;
        for (BigDecimal drawdown : drawdowns) {
            if (drawdown.signum() > 0) {
                current++;
                longest = Math.max(longest, current);
            } else {
                current = 0;
            }
        }
        return longest;
    }
}
