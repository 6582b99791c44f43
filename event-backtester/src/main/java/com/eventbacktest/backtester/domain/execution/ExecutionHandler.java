package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.event.OrderEvent;

/**
 * Turns orders into fills. Every accepted order yields exactly one FillEvent.
 */
public interface ExecutionHandler {

    /**
     * Execute an order, eventually pushing its FillEvent onto the event queue.
     *
     * @param order the order to execute
     */
    void executeOrder(OrderEvent order);

    /**
     * Orders accepted but not yet filled or cancelled. Handlers that fill
     * synchronously never have any.
     */
    default int getOutstandingOrderCount() {
        return 0;
    }
}
