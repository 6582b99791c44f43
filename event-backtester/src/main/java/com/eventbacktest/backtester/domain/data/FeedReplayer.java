package com.eventbacktest.backtester.domain.data;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Publishes an aligned series into a {@link LiveFeedBarSource} from a
 * background thread, one snapshot per interval, and closes the feed when done.
 * Steps before every symbol has its first bar are skipped, since a live
 * snapshot must carry a bar for each tracked symbol.
 */
@Slf4j
public class FeedReplayer implements Runnable {

    private final LiveFeedBarSource feed;
    private final AlignedSeries series;
    private final Duration interval;

    public FeedReplayer(LiveFeedBarSource feed, AlignedSeries series, Duration interval) {
        this.feed = feed;
        this.series = series;
        this.interval = interval == null ? Duration.ZERO : interval;
    }

    /**
     * Start publishing on a daemon thread.
     */
    public Thread start() {
        Thread thread = new Thread(this, "live-feed-replay");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    @Override
    public void run() {
        int published = 0;
        try {
            for (int i = 0; i < series.length(); i++) {
                Map<String, Bar> snapshot = snapshotAt(i);
                if (snapshot == null) {
                    continue;
                }
                LocalDateTime timestamp = series.getIndex().get(i);
                feed.publish(timestamp, snapshot);
                published++;
                if (!interval.isZero() && !interval.isNegative()) {
                    Thread.sleep(interval.toMillis());
                }
            }
            log.info("Feed replay finished after {} snapshots", published);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Feed replay interrupted after {} snapshots", published);
        } finally {
            feed.close();
        }
    }

    private Map<String, Bar> snapshotAt(int position) {
        Map<String, Bar> snapshot = new LinkedHashMap<>();
        for (String symbol : feed.getSymbols()) {
            Bar bar = series.barAt(symbol, position);
            if (bar == null) {
                return null;
            }
            snapshot.put(symbol, bar);
        }
        return snapshot;
    }
}
