package com.eventbacktest.backtester.domain;

import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.event.Event;
import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.domain.event.SignalEvent;
import com.eventbacktest.backtester.domain.execution.BrokerSubmissionException;
import com.eventbacktest.backtester.domain.execution.ExecutionHandler;
import com.eventbacktest.backtester.domain.portfolio.PerformanceReport;
import com.eventbacktest.backtester.domain.portfolio.Portfolio;
import com.eventbacktest.backtester.domain.strategy.Strategy;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;

/**
 * Drives one event-driven backtest: advances the bar source one timestep at a
 * time and drains the event queue to empty after each step, dispatching every
 * event to the role that owns its type.
 *
 * <p>An engine runs once. Events enqueued while another event is handled are
 * always processed before the next timestep. Once the bars run out, fills for
 * orders still held by an asynchronous execution handler are awaited for up to
 * the settle timeout before results are finalized.
 */
@Slf4j
public class BacktestEngine {

    static final Duration DEFAULT_SETTLE_TIMEOUT = Duration.ofSeconds(5);
    private static final long SETTLE_POLL_MS = 10;

    private final EventQueue events;
    private final BarSource bars;
    private final Strategy strategy;
    private final Portfolio portfolio;
    private final ExecutionHandler execution;
    private final Duration heartbeat;
    private final int periodsPerYear;
    private final Duration settleTimeout;

    private volatile boolean cancelled;
    private volatile BacktestState state = BacktestState.RUNNING;
    private boolean started;

    private long timesteps;
    private long signalCount;
    private long orderCount;
    private long fillCount;
    private long lookupErrorCount;

    @Builder
    public BacktestEngine(@NonNull EventQueue events, @NonNull BarSource bars, @NonNull Strategy strategy,
                          @NonNull Portfolio portfolio, @NonNull ExecutionHandler execution,
                          Duration heartbeat, Integer periodsPerYear, Duration settleTimeout) {
        this.events = events;
        this.bars = bars;
        this.strategy = strategy;
        this.portfolio = portfolio;
        this.execution = execution;
        this.heartbeat = heartbeat == null ? Duration.ZERO : heartbeat;
        this.periodsPerYear = periodsPerYear == null ? 252 : periodsPerYear;
        this.settleTimeout = settleTimeout == null ? DEFAULT_SETTLE_TIMEOUT : settleTimeout;
    }

    /**
     * Run the backtest to completion (or cancellation) and return its report.
     *
     * @throws IllegalStateException if this engine has already been run
     */
    public BacktestReport run() {
        synchronized (this) {
            if (started) {
                throw new IllegalStateException("Backtest engine has already been run");
            }
            started = true;
        }

        log.info("Starting backtest - Strategy: {}, Symbols: {}", strategy.getName(), bars.getSymbols());

        while (state == BacktestState.RUNNING) {
            if (cancelled) {
                log.warn("Backtest cancelled after {} timesteps", timesteps);
                state = BacktestState.EXHAUSTED;
                break;
            }

            if (bars.isExhausted()) {
                state = BacktestState.EXHAUSTED;
            } else {
                bars.updateBars();
            }

            drain();

            if (state == BacktestState.RUNNING) {
                pause();
            }
        }

        settle();
        return finish();
    }

    /**
     * Request that the run stop before its next timestep. Safe to call from any thread.
     */
    public void cancel() {
        cancelled = true;
    }

    public BacktestState getState() {
        return state;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    private void drain() {
        Event event;
        while ((event = events.pop()) != null) {
            try {
                dispatch(event);
            } catch (UnknownSymbolException e) {
                lookupErrorCount++;
                log.warn("Lookup failed while handling {} event: {}", event.getType(), e.getMessage());
            } catch (BrokerSubmissionException e) {
                log.warn("Broker rejected order: {}", e.getMessage());
            }
        }
    }

    private void settle() {
        int outstanding = execution.getOutstandingOrderCount();
        if (outstanding == 0) {
            return;
        }
        log.info("Waiting up to {} ms for {} outstanding orders", settleTimeout.toMillis(), outstanding);

        long deadline = System.nanoTime() + settleTimeout.toNanos();
        while (execution.getOutstandingOrderCount() > 0) {
            if (System.nanoTime() >= deadline) {
                log.warn("{} orders still outstanding after {} ms, finalizing without their fills",
                        execution.getOutstandingOrderCount(), settleTimeout.toMillis());
                break;
            }
            try {
                Thread.sleep(SETTLE_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for outstanding fills");
                break;
            }
            drain();
        }
        drain();
    }

    private void dispatch(Event event) {
        switch (event.getType()) {
            case MARKET -> {
                timesteps++;
                MarketEvent market = (MarketEvent) event;
                strategy.calculateSignals(market);
                portfolio.updateTimeindex(market);
            }
            case SIGNAL -> {
                signalCount++;
                portfolio.updateSignal((SignalEvent) event);
            }
            case ORDER -> {
                orderCount++;
                execution.executeOrder((OrderEvent) event);
            }
            case FILL -> {
                fillCount++;
                portfolio.updateFill((FillEvent) event);
            }
        }
    }

    private void pause() {
        if (heartbeat.isZero() || heartbeat.isNegative()) {
            return;
        }
        try {
            Thread.sleep(heartbeat.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Heartbeat interrupted, cancelling backtest");
            cancelled = true;
        }
    }

    private BacktestReport finish() {
        PerformanceReport performance = portfolio.createPerformanceReport(periodsPerYear);
        state = BacktestState.DONE;

        log.info("Backtest completed - Timesteps: {}, Signals: {}, Orders: {}, Fills: {}, " +
                        "Total Return: {}%, Sharpe: {}, Max DD: {}%, DD Duration: {}",
                timesteps, signalCount, orderCount, fillCount,
                performance.getTotalReturn(), performance.getSharpeRatio(),
                performance.getMaxDrawdown(), performance.getDrawdownDuration());

        return BacktestReport.builder()
                .strategyName(strategy.getName())
                .state(state)
                .cancelled(cancelled)
                .timesteps(timesteps)
                .signalCount(signalCount)
                .orderCount(orderCount)
                .fillCount(fillCount)
                .lookupErrorCount(lookupErrorCount)
                .performance(performance)
                .build();
    }

    /**
     * Outcome of a backtest run.
     */
    @Value
    @Builder
    public static class BacktestReport {
        String strategyName;
        BacktestState state;
        boolean cancelled;
        long timesteps;
        long signalCount;
        long orderCount;
        long fillCount;
        long lookupErrorCount;
        PerformanceReport performance;
    }
}
