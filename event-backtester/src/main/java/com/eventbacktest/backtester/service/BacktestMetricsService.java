package com.eventbacktest.backtester.service;

import com.eventbacktest.backtester.domain.BacktestEngine.BacktestReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Service for tracking backtest run metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class BacktestMetricsService {

    private final Counter runsCompletedCounter;
    private final Counter runsFailedCounter;
    private final Counter signalsCounter;
    private final Counter ordersCounter;
    private final Counter fillsCounter;
    private final Timer runTimer;

    public BacktestMetricsService(MeterRegistry meterRegistry) {
        this.runsCompletedCounter = Counter.builder("backtest.runs.completed")
                .description("Total number of backtest runs completed successfully")
                .register(meterRegistry);

        this.runsFailedCounter = Counter.builder("backtest.runs.failed")
                .description("Total number of backtest runs that failed")
                .register(meterRegistry);

        this.signalsCounter = Counter.builder("backtest.events.signals")
                .description("Signal events dispatched across all runs")
                .register(meterRegistry);

        this.ordersCounter = Counter.builder("backtest.events.orders")
                .description("Order events dispatched across all runs")
                .register(meterRegistry);

        this.fillsCounter = Counter.builder("backtest.events.fills")
                .description("Fill events dispatched across all runs")
                .register(meterRegistry);

        this.runTimer = Timer.builder("backtest.run.time")
                .description("Backtest run wall-clock time")
                .register(meterRegistry);

        log.info("BacktestMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record a completed run with its event counts and execution time.
     */
    public void recordRunCompleted(BacktestReport report, long executionTimeMs) {
        runsCompletedCounter.increment();
        signalsCounter.increment(report.getSignalCount());
        ordersCounter.increment(report.getOrderCount());
        fillsCounter.increment(report.getFillCount());
        runTimer.record(executionTimeMs, TimeUnit.MILLISECONDS);
    }

    public void recordRunFailed() {
        runsFailedCounter.increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: Completed=%d, Failed=%d, Signals=%d, Orders=%d, Fills=%d, AvgRunTime=%.2fs",
                (long) runsCompletedCounter.count(),
                (long) runsFailedCounter.count(),
                (long) signalsCounter.count(),
                (long) ordersCounter.count(),
                (long) fillsCounter.count(),
                runTimer.mean(TimeUnit.SECONDS));
    }
}
