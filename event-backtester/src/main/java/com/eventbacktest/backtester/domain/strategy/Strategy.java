package com.eventbacktest.backtester.domain.strategy;

import com.eventbacktest.backtester.domain.event.MarketEvent;

/**
 * Strategy interface for generating trading signals.
 * Strategies read bars from a bar source and push SignalEvents onto the
 * event queue; they never touch the portfolio directly.
 */
public interface Strategy {

    /**
     * Called once for every MarketEvent, in chronological order.
     *
     * @param event the market event announcing a new synchronized timestep
     */
    void calculateSignals(MarketEvent event);

    /**
     * Get the strategy name.
     */
    String getName();
}
