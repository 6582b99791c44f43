package com.eventbacktest.backtester.domain;

import com.eventbacktest.backtester.domain.BacktestEngine.BacktestReport;
import com.eventbacktest.backtester.domain.data.Bar;
import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.HistoricBarSource;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.domain.event.OrderEvent;
import com.eventbacktest.backtester.domain.event.SignalDirection;
import com.eventbacktest.backtester.domain.event.SignalEvent;
import com.eventbacktest.backtester.domain.execution.BrokerExecutionHandler;
import com.eventbacktest.backtester.domain.execution.ExecutionHandler;
import com.eventbacktest.backtester.domain.execution.FixedCommissionModel;
import com.eventbacktest.backtester.domain.execution.PaperBrokerSession;
import com.eventbacktest.backtester.domain.execution.SimulatedExecutionHandler;
import com.eventbacktest.backtester.domain.portfolio.Portfolio;
import com.eventbacktest.backtester.domain.strategy.Strategy;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import com.eventbacktest.backtester.infrastructure.InMemoryEventQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntConsumer;

import static com.eventbacktest.backtester.domain.data.BarFixtures.day;
import static com.eventbacktest.backtester.domain.data.BarFixtures.series;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the full event loop over small synthetic data sets.
 */
class BacktestEngineTest {

    private static final BigDecimal CAPITAL = new BigDecimal("100000.00");

    private EventQueue events;
    private HistoricBarSource bars;
    private Portfolio portfolio;

    @BeforeEach
    void setUp() {
        events = new InMemoryEventQueue();
        Map<String, List<Bar>> nativeSeries = new LinkedHashMap<>();
        nativeSeries.put("AAA", series("AAA", 100, 100, 100, 100, 100));
        nativeSeries.put("BBB", series("BBB", 50, 51, 52, 53, 54));
        bars = new HistoricBarSource(events, List.of("AAA", "BBB"), nativeSeries);
        portfolio = new Portfolio(bars, events, CAPITAL, 100);
    }

    /**
     * Strategy whose behaviour per bar (1-based) is supplied by the test.
     */
    private class ScriptedStrategy implements Strategy {
        private final IntConsumer onBar;
        private int bar;

        ScriptedStrategy(IntConsumer onBar) {
            this.onBar = onBar;
        }

        @Override
        public void calculateSignals(MarketEvent event) {
            bar++;
            onBar.accept(bar);
        }

        @Override
        public String getName() {
            return "Scripted";
        }

        void signal(String symbol, SignalDirection direction) {
            events.push(SignalEvent.builder()
                    .strategyId("scripted")
                    .symbol(symbol)
                    .timestamp(bars.getCurrentDatetime().orElse(null))
                    .direction(direction)
                    .build());
        }
    }

    private BacktestEngine engine(Strategy strategy) {
        return BacktestEngine.builder()
                .events(events)
                .bars(bars)
                .strategy(strategy)
                .portfolio(portfolio)
                .execution(new SimulatedExecutionHandler(events, bars, FixedCommissionModel.zero(), "ARCA"))
                .build();
    }

    @Test
    void testLongThenExitAtSamePriceLeavesCashUnchanged() {
        // Arrange
        ScriptedStrategy[] holder = new ScriptedStrategy[1];
        holder[0] = new ScriptedStrategy(bar -> {
            if (bar == 2) {
                holder[0].signal("AAA", SignalDirection.LONG);
            } else if (bar == 4) {
                holder[0].signal("AAA", SignalDirection.EXIT);
            }
        });
        BacktestEngine engine = engine(holder[0]);

        // Act
        BacktestReport report = engine.run();

        // Assert
        assertEquals(BacktestState.DONE, report.getState());
        assertEquals(BacktestState.DONE, engine.getState());
        assertEquals(5, report.getTimesteps());
        assertEquals(2, report.getSignalCount());
        assertEquals(2, report.getOrderCount());
        assertEquals(2, report.getFillCount());
        assertEquals(5, report.getPerformance().getEquityCurve().size());
        assertEquals(0, CAPITAL.compareTo(portfolio.getCash()));
        assertEquals(0L, portfolio.getPosition("AAA"));
        assertEquals(0, CAPITAL.compareTo(report.getPerformance().getFinalEquity()));
        assertFalse(report.isCancelled());
    }

    @Test
    void testEventsEnqueuedDuringDispatchAreHandledWithinTheSameTimestep() {
        // Arrange
        ScriptedStrategy[] holder = new ScriptedStrategy[1];
        holder[0] = new ScriptedStrategy(bar -> {
            if (bar == 2) {
                holder[0].signal("BBB", SignalDirection.LONG);
            }
            if (bar == 3) {
                assertEquals(100L, portfolio.getPosition("BBB"), "Fill from bar 2 applied before bar 3");
            }
        });

        // Act
        engine(holder[0]).run();

        // Assert
        assertEquals(1, portfolio.getFills().size());
        assertEquals(day(1), portfolio.getFills().get(0).getTimestamp());
        assertEquals(0, new BigDecimal("51").compareTo(portfolio.getFills().get(0).getFillCost()));
        // Bar 3 row is marked with the open position: 100000 - 5100 + 100 x 52
        assertEquals(0, new BigDecimal("100100").compareTo(portfolio.getEquityCurve().get(2).getTotal()));
    }

    @Test
    void testLookupErrorIsCountedAndRunContinues() {
        // Arrange
        ScriptedStrategy[] holder = new ScriptedStrategy[1];
        holder[0] = new ScriptedStrategy(bar -> {
            if (bar == 1) {
                holder[0].signal("NOT_TRACKED", SignalDirection.LONG);
            }
        });

        // Act
        BacktestReport report = engine(holder[0]).run();

        // Assert
        assertEquals(1, report.getLookupErrorCount());
        assertEquals(5, report.getTimesteps());
        assertEquals(0, report.getOrderCount());
        assertEquals(BacktestState.DONE, report.getState());
    }

    @Test
    void testCancelStopsBeforeNextTimestep() {
        // Arrange
        BacktestEngine[] holder = new BacktestEngine[1];
        Strategy cancelling = new ScriptedStrategy(bar -> {
            if (bar == 2) {
                holder[0].cancel();
            }
        });
        holder[0] = engine(cancelling);

        // Act
        BacktestReport report = holder[0].run();

        // Assert
        assertTrue(report.isCancelled());
        assertEquals(2, report.getTimesteps());
        assertEquals(2, report.getPerformance().getEquityCurve().size());
        assertEquals(BacktestState.DONE, report.getState());
    }

    @Test
    void testEngineRunsOnlyOnce() {
        BacktestEngine engine = engine(new ScriptedStrategy(bar -> { }));
        engine.run();

        assertThrows(IllegalStateException.class, engine::run);
    }

    @Test
    void testHeartbeatDoesNotChangeOutcome() {
        // Arrange
        BacktestEngine engine = BacktestEngine.builder()
                .events(events)
                .bars(bars)
                .strategy(new ScriptedStrategy(bar -> { }))
                .portfolio(portfolio)
                .execution(new SimulatedExecutionHandler(events, bars, FixedCommissionModel.zero(), "ARCA"))
                .heartbeat(Duration.ofMillis(1))
                .periodsPerYear(252)
                .build();

        // Act
        BacktestReport report = engine.run();

        // Assert
        assertEquals(5, report.getTimesteps());
        assertEquals(0, report.getSignalCount());
        assertEquals(0, BigDecimal.ZERO.compareTo(report.getPerformance().getTotalReturn()));
    }

    @Test
    void testBrokerFillForFinalBarIsAppliedBeforeFinishing() {
        // Arrange - order placed on the last bar, filled on the broker callback thread
        ScriptedStrategy[] holder = new ScriptedStrategy[1];
        holder[0] = new ScriptedStrategy(bar -> {
            if (bar == 5) {
                holder[0].signal("BBB", SignalDirection.LONG);
            }
        });

        try (PaperBrokerSession session = new PaperBrokerSession(
                symbol -> bars.getLatestBarValue(symbol, BarField.CLOSE).orElse(null))) {
            BrokerExecutionHandler execution = new BrokerExecutionHandler(events, session,
                    FixedCommissionModel.zero(), "SMART", "ARCA", "USD");
            BacktestEngine engine = BacktestEngine.builder()
                    .events(events)
                    .bars(bars)
                    .strategy(holder[0])
                    .portfolio(portfolio)
                    .execution(execution)
                    .settleTimeout(Duration.ofSeconds(5))
                    .build();

            // Act
            BacktestReport report = engine.run();

            // Assert
            assertEquals(1, report.getOrderCount());
            assertEquals(1, report.getFillCount());
            assertEquals(100, portfolio.getPosition("BBB"));
            assertEquals(0, new BigDecimal("94600").compareTo(portfolio.getCash()));
            assertEquals(0, execution.getOutstandingOrderCount());
            assertTrue(events.isEmpty());
        }
    }

    @Test
    void testOrderThatNeverFillsIsAbandonedAfterSettleTimeout() {
        // Arrange
        ExecutionHandler silentBroker = new ExecutionHandler() {
            private int accepted;

            @Override
            public void executeOrder(OrderEvent order) {
                accepted++;
            }

            @Override
            public int getOutstandingOrderCount() {
                return accepted;
            }
        };
        ScriptedStrategy[] holder = new ScriptedStrategy[1];
        holder[0] = new ScriptedStrategy(bar -> {
            if (bar == 1) {
                holder[0].signal("AAA", SignalDirection.LONG);
            }
        });
        BacktestEngine engine = BacktestEngine.builder()
                .events(events)
                .bars(bars)
                .strategy(holder[0])
                .portfolio(portfolio)
                .execution(silentBroker)
                .settleTimeout(Duration.ofMillis(50))
                .build();

        // Act
        BacktestReport report = assertTimeoutPreemptively(Duration.ofSeconds(5), engine::run);

        // Assert
        assertEquals(BacktestState.DONE, report.getState());
        assertEquals(1, report.getOrderCount());
        assertEquals(0, report.getFillCount());
        assertEquals(0, portfolio.getPosition("AAA"));
    }
}
