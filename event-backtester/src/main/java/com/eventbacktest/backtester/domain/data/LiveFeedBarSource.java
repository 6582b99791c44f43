package com.eventbacktest.backtester.domain.data;

import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bar source fed by a producer pushing pre-synchronized snapshots.
 * A snapshot must hold one bar for every tracked symbol. The source is
 * exhausted once {@link #close()} has been called and the backlog is drained.
 */
@Slf4j
public class LiveFeedBarSource extends AbstractBarSource {

    private final BlockingQueue<Snapshot> backlog = new LinkedBlockingQueue<>();
    private final Duration pollTimeout;
    private volatile boolean closed = false;

    public LiveFeedBarSource(EventQueue events, List<String> symbols, Duration pollTimeout) {
        super(events, symbols);
        this.pollTimeout = pollTimeout;
    }

    /**
     * Offer the next synchronized step.
     *
     * @throws IllegalArgumentException if any tracked symbol is missing from the snapshot
     * @throws IllegalStateException if the feed has been closed
     */
    public void publish(LocalDateTime timestamp, Map<String, Bar> bars) {
        if (closed) {
            throw new IllegalStateException("Live feed is closed");
        }
        for (String symbol : getSymbols()) {
            if (!bars.containsKey(symbol)) {
                throw new IllegalArgumentException("Snapshot at " + timestamp + " has no bar for " + symbol);
            }
        }
        backlog.add(new Snapshot(timestamp, Map.copyOf(bars)));
    }

    /**
     * Stop accepting snapshots. Already published snapshots are still replayed.
     */
    public void close() {
        closed = true;
        log.info("Live feed closed with {} snapshots pending", backlog.size());
    }

    @Override
    public boolean updateBars() {
        if (isExhausted()) {
            return false;
        }
        Snapshot next;
        try {
            next = backlog.poll(pollTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for live bars");
            markExhausted();
            return false;
        }

        if (next == null) {
            if (closed && backlog.isEmpty()) {
                markExhausted();
            }
            return false;
        }
        appendStep(next.timestamp, next.bars);
        return true;
    }

    private static final class Snapshot {
        private final LocalDateTime timestamp;
        private final Map<String, Bar> bars;

        private Snapshot(LocalDateTime timestamp, Map<String, Bar> bars) {
            this.timestamp = timestamp;
            this.bars = bars;
        }
    }
}
