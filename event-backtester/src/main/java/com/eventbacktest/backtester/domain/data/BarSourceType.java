package com.eventbacktest.backtester.domain.data;

/**
 * Where a run loads its bars from.
 */
public enum BarSourceType {
    CSV,
    DATABASE,
    /** Stored daily prices pushed through a live feed by a background publisher. */
    LIVE_REPLAY
}
