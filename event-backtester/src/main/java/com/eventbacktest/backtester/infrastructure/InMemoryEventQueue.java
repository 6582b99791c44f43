package com.eventbacktest.backtester.infrastructure;

import com.eventbacktest.backtester.domain.event.Event;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Unbounded in-memory implementation of the EventQueue.
 * Thread-safe so broker callbacks may push fills from their own threads.
 */
@Slf4j
public class InMemoryEventQueue implements EventQueue {

    private final BlockingQueue<Event> events = new LinkedBlockingQueue<>();

    @Override
    public void push(Event event) {
        if (event == null) {
            log.error("Cannot push null event to queue");
            throw new IllegalArgumentException("Event cannot be null");
        }
        events.add(event);
        log.trace("Enqueued {} event. Queue size: {}", event.getType(), events.size());
    }

    @Override
    public Event pop() {
        return events.poll();
    }

    @Override
    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public int size() {
        return events.size();
    }
}
