package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.domain.event.Event;

/**
 * FIFO channel shared by the orchestrator and every role.
 * The orchestrator is the only consumer; every role may produce.
 */
public interface EventQueue {

    /**
     * Append an event to the tail of the queue.
     *
     * @param event the event to enqueue
     */
    void push(Event event);

    /**
     * Remove the head of the queue.
     *
     * @return the event, or null if the queue is empty
     */
    Event pop();

    boolean isEmpty();

    int size();
}
