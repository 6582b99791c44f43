package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.event.Event;
import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.OrderDirection;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class PaperBrokerSessionTest {

    private EventQueue events;
    private PaperBrokerSession session;
    private BrokerExecutionHandler handler;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventQueue();
        Map<String, BigDecimal> prices = Map.of("AAPL", new BigDecimal("190.10"));
        session = new PaperBrokerSession(prices::get);
        handler = new BrokerExecutionHandler(events, session, new PerShareCommissionModel(), "SMART", "NASDAQ", "USD");
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    @Test
    void testOrderIsFilledOnceOnCallbackThread() throws InterruptedException {
        // Act
        handler.executeOrder(OrderEvent.builder().symbol("AAPL").quantity(100).direction(OrderDirection.BUY).build());
        assertTrue(session.awaitIdle(5, TimeUnit.SECONDS));

        // Assert - the session reports "filled" twice, only one fill reaches the queue
        Event event = events.pop();
        assertTrue(event instanceof FillEvent);
        FillEvent fill = (FillEvent) event;
        assertEquals("AAPL", fill.getSymbol());
        assertEquals(new BigDecimal("190.10"), fill.getFillCost());
        assertEquals(0, new BigDecimal("1.30").compareTo(fill.getCommission()));
        assertNull(events.pop());
        assertTrue(handler.isFilled(1));
        assertEquals(0, handler.getOutstandingOrderCount());
    }

    @Test
    void testOrderWithoutPriceIsCancelledWithoutFill() throws InterruptedException {
        handler.executeOrder(OrderEvent.builder().symbol("UNKNOWN").quantity(1).direction(OrderDirection.SELL).build());
        assertTrue(session.awaitIdle(5, TimeUnit.SECONDS));

        assertTrue(events.isEmpty());
        assertFalse(handler.isFilled(1));
        assertEquals(0, handler.getOutstandingOrderCount(), "A cancelled order is no longer outstanding");
    }

    @Test
    void testSubmitAfterCloseFails() {
        session.close();

        assertThrows(BrokerSubmissionException.class, () -> handler.executeOrder(
                OrderEvent.builder().symbol("AAPL").quantity(1).direction(OrderDirection.BUY).build()));
    }
}
