package com.eventbacktest.backtester.domain.execution;

import com.eventbacktest.backtester.domain.data.Bar;
import com.eventbacktest.backtester.domain.data.HistoricBarSource;
import com.eventbacktest.backtester.domain.event.FillEvent;
import com.eventbacktest.backtester.domain.event.OrderDirection;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.eventbacktest.backtester.domain.data.BarFixtures.bar;
import static com.eventbacktest.backtester.domain.data.BarFixtures.day;
import static com.eventbacktest.backtester.domain.data.BarFixtures.series;
import static org.junit.jupiter.api.Assertions.*;

class SimulatedExecutionHandlerTest {

    private EventQueue events;
    private HistoricBarSource bars;
    private SimulatedExecutionHandler handler;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventQueue();
        Map<String, List<Bar>> nativeSeries = new LinkedHashMap<>();
        nativeSeries.put("AAA", series("AAA", 100, 101));
        nativeSeries.put("LATE", List.of(bar("LATE", 1, "5")));
        bars = new HistoricBarSource(events, List.of("AAA", "LATE"), nativeSeries);
        handler = new SimulatedExecutionHandler(events, bars, new FixedCommissionModel(new BigDecimal("1.00")), "ARCA");
        bars.updateBars();
        events.pop();
    }

    @Test
    void testOrderIsFilledImmediatelyAtLatestClose() {
        // Act
        handler.executeOrder(OrderEvent.builder().symbol("AAA").quantity(10).direction(OrderDirection.BUY).build());

        // Assert
        FillEvent fill = (FillEvent) events.pop();
        assertNotNull(fill);
        assertEquals("AAA", fill.getSymbol());
        assertEquals("ARCA", fill.getExchange());
        assertEquals(10, fill.getQuantity());
        assertEquals(OrderDirection.BUY, fill.getDirection());
        assertEquals(new BigDecimal("100"), fill.getFillCost());
        assertEquals(new BigDecimal("1.00"), fill.getCommission());
        assertEquals(day(0), fill.getTimestamp());
        assertTrue(events.isEmpty(), "Exactly one fill per order");
    }

    @Test
    void testOrderWithoutObservedPriceIsRejected() {
        handler.executeOrder(OrderEvent.builder().symbol("LATE").quantity(1).direction(OrderDirection.SELL).build());

        assertTrue(events.isEmpty());
    }
}
