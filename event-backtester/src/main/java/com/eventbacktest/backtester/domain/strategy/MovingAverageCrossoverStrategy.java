package com.eventbacktest.backtester.domain.strategy;

import com.eventbacktest.backtester.domain.data.BarField;
import com.eventbacktest.backtester.domain.data.BarSource;
import com.eventbacktest.backtester.domain.event.MarketEvent;
import com.eventbacktest.backtester.domain.event.SignalDirection;
import com.eventbacktest.backtester.domain.event.SignalEvent;
import com.eventbacktest.backtester.infrastructure.EventQueue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Moving Average Crossover Strategy.
 * Goes long when the short simple moving average of adjusted close is above
 * the long one while flat, exits when it falls below while in position.
 */
@Slf4j
public class MovingAverageCrossoverStrategy implements Strategy {

    private final String strategyId;
    private final BarSource bars;
    private final EventQueue events;
    private final int shortWindow;
    private final int longWindow;

    private final Map<String, Boolean> bought = new HashMap<>();

    public MovingAverageCrossoverStrategy(String strategyId, BarSource bars, EventQueue events,
                                          int shortWindow, int longWindow) {
        if (shortWindow <= 0) {
            throw new IllegalArgumentException("Short window must be positive");
        }
        if (shortWindow >= longWindow) {
            throw new IllegalArgumentException("Short window must be less than long window");
        }
        this.strategyId = strategyId;
        this.bars = bars;
        this.events = events;
        this.shortWindow = shortWindow;
        this.longWindow = longWindow;

        for (String symbol : bars.getSymbols()) {
            bought.put(symbol, false);
        }
    }

    @Override
    public void calculateSignals(MarketEvent event) {
        for (String symbol : bars.getSymbols()) {
            List<BigDecimal> closes = bars.getLatestBarsValues(symbol, BarField.ADJ_CLOSE, longWindow);

            // Wait until we have enough data
            if (closes.size() < longWindow) {
                continue;
            }

            BigDecimal shortMA = calculateMA(closes.subList(closes.size() - shortWindow, closes.size()));
            BigDecimal longMA = calculateMA(closes);
            boolean inPosition = bought.get(symbol);

            if (!inPosition && shortMA.compareTo(longMA) > 0) {
                emit(symbol, SignalDirection.LONG);
                bought.put(symbol, true);
                log.debug("MA Crossover: LONG {} (Short MA: {}, Long MA: {})", symbol, shortMA, longMA);
            } else if (inPosition && shortMA.compareTo(longMA) < 0) {
                emit(symbol, SignalDirection.EXIT);
                bought.put(symbol, false);
                log.debug("MA Crossover: EXIT {} (Short MA: {}, Long MA: {})", symbol, shortMA, longMA);
            }
        }
    }

    /**
     * Whether the strategy currently considers itself in the market for a symbol.
     */
    public boolean isInPosition(String symbol) {
        return bought.getOrDefault(symbol, false);
    }

    @Override
    public String getName() {
        return "MovingAverageCrossover(" + shortWindow + "," + longWindow + ")";
    }

    private void emit(String symbol, SignalDirection direction) {
        events.push(SignalEvent.builder()
                .strategyId(strategyId)
                .symbol(symbol)
                .timestamp(bars.getLatestBarDatetime(symbol).orElse(null))
                .direction(direction)
                .strength(1.0)
                .build());
    }

    private BigDecimal calculateMA(List<BigDecimal> window) {
        BigDecimal sum = window.stream()
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return sum.divide(BigDecimal.valueOf(window.size()), 8, RoundingMode.HALF_UP);
    }
}
